package org.dxworks.sitegen.parser;

/** Anchor (or alt) text and destination of an inline link or image. */
public record InlineReference(String text, String url) {
}
