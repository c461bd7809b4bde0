package org.dxworks.sitegen.parser;

public final class TitleExtractor {

    private static final String H1_PREFIX = "# ";

    private TitleExtractor() {}

    /**
     * Returns the text of the first line starting with {@code "# "}, stripped.
     *
     * @throws NoHeadingFoundException if the document has no such line
     */
    public static String extractTitle(String markdown) {
        for (String line : markdown.split("\n", -1)) {
            if (line.startsWith(H1_PREFIX)) {
                return line.substring(H1_PREFIX.length()).strip();
            }
        }
        throw new NoHeadingFoundException();
    }
}
