package org.dxworks.sitegen.parser;

public class NoHeadingFoundException extends IllegalArgumentException {

    public NoHeadingFoundException() {
        super("No h1 header found in markdown");
    }
}
