package org.dxworks.sitegen;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

public class ContentFiles {

    private static final String MARKDOWN_EXTENSION = ".md";
    private static final String HTML_EXTENSION = ".html";

    public static boolean isMarkdown(Path filePath) {
        return filePath.getFileName().toString().toLowerCase().endsWith(MARKDOWN_EXTENSION);
    }

    public static String toHtmlFileName(String markdownName) {
        return markdownName.substring(0, markdownName.length() - MARKDOWN_EXTENSION.length()) + HTML_EXTENSION;
    }

    public static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable files are kept so that generation reports the real error
            return true;
        }
    }
}
