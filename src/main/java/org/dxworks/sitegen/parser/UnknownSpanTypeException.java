package org.dxworks.sitegen.parser;

import org.dxworks.sitegen.model.text.TextType;

public class UnknownSpanTypeException extends IllegalArgumentException {

    public UnknownSpanTypeException(TextType textType) {
        super("Unknown text type: " + textType);
    }
}
