package org.dxworks.sitegen.parser;

import org.dxworks.sitegen.model.text.TextSpan;
import org.dxworks.sitegen.model.text.TextType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a line of inline markdown into styled {@link TextSpan}s.
 * Images and links are extracted first, then the {@code **}, {@code _} and {@code `}
 * delimiters are applied in that order. Styles never nest.
 */
public final class InlineTokenizer {

    private static final Pattern IMAGE_PATTERN = Pattern.compile("!\\[([^\\[\\]]*)\\]\\(([^\\(\\)]*)\\)");
    // a '[' directly after '!' belongs to an image
    private static final Pattern LINK_PATTERN = Pattern.compile("(?<!!)\\[([^\\[\\]]*)\\]\\(([^\\(\\)]*)\\)");

    private InlineTokenizer() {}

    public static List<TextSpan> tokenize(String text) {
        List<TextSpan> spans = List.of(TextSpan.plain(text));
        spans = splitImages(spans);
        spans = splitLinks(spans);
        spans = splitDelimiter(spans, "**", TextType.BOLD);
        spans = splitDelimiter(spans, "_", TextType.ITALIC);
        spans = splitDelimiter(spans, "`", TextType.CODE);
        return spans;
    }

    public static List<TextSpan> splitImages(List<TextSpan> spans) {
        return splitByPattern(spans, IMAGE_PATTERN, TextType.IMAGE);
    }

    public static List<TextSpan> splitLinks(List<TextSpan> spans) {
        return splitByPattern(spans, LINK_PATTERN, TextType.LINK);
    }

    /**
     * Splits every plain span on {@code delimiter}. Parts alternate between plain and
     * {@code textType}, so a delimiter at either edge produces an empty plain span.
     *
     * @throws UnclosedDelimiterException if a span holds an odd number of delimiters
     */
    public static List<TextSpan> splitDelimiter(List<TextSpan> spans, String delimiter, TextType textType) {
        List<TextSpan> result = new ArrayList<>();
        for (TextSpan span : spans) {
            if (!span.isPlain()) {
                result.add(span);
                continue;
            }
            String[] parts = span.getText().split(Pattern.quote(delimiter), -1);
            if (parts.length == 1) {
                result.add(span);
                continue;
            }
            if (parts.length % 2 == 0) {
                throw new UnclosedDelimiterException(delimiter);
            }
            for (int i = 0; i < parts.length; i++) {
                result.add(new TextSpan(parts[i], i % 2 == 0 ? TextType.TEXT : textType));
            }
        }
        return result;
    }

    public static List<InlineReference> extractImages(String text) {
        return extract(IMAGE_PATTERN, text);
    }

    public static List<InlineReference> extractLinks(String text) {
        return extract(LINK_PATTERN, text);
    }

    private static List<InlineReference> extract(Pattern pattern, String text) {
        List<InlineReference> references = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            references.add(new InlineReference(matcher.group(1), matcher.group(2)));
        }
        return references;
    }

    private static List<TextSpan> splitByPattern(List<TextSpan> spans, Pattern pattern, TextType textType) {
        List<TextSpan> result = new ArrayList<>();
        for (TextSpan span : spans) {
            if (!span.isPlain()) {
                result.add(span);
                continue;
            }
            String text = span.getText();
            Matcher matcher = pattern.matcher(text);
            int lastEnd = 0;
            while (matcher.find()) {
                String before = text.substring(lastEnd, matcher.start());
                if (!before.isEmpty()) {
                    result.add(TextSpan.plain(before));
                }
                result.add(new TextSpan(matcher.group(1), textType, matcher.group(2)));
                lastEnd = matcher.end();
            }
            if (lastEnd < text.length()) {
                result.add(lastEnd == 0 ? span : TextSpan.plain(text.substring(lastEnd)));
            } else if (lastEnd == 0) {
                result.add(span);
            }
        }
        return result;
    }
}
