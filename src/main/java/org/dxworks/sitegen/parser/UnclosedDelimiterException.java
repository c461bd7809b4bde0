package org.dxworks.sitegen.parser;

public class UnclosedDelimiterException extends IllegalArgumentException {
    private final String delimiter;

    public UnclosedDelimiterException(String delimiter) {
        super("Invalid markdown: unclosed delimiter '" + delimiter + "'");
        this.delimiter = delimiter;
    }

    public String getDelimiter() {
        return delimiter;
    }
}
