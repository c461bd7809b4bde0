package org.dxworks.sitegen.model.block;

public enum BlockType {
    HEADING,
    CODE,
    QUOTE,
    UNORDERED_LIST,
    ORDERED_LIST,
    PARAGRAPH
}
