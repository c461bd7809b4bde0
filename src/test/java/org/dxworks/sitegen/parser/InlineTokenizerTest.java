package org.dxworks.sitegen.parser;

import org.dxworks.sitegen.model.text.TextSpan;
import org.dxworks.sitegen.model.text.TextType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InlineTokenizerTest {

    @Test
    void tokenize_allStyles() {
        List<TextSpan> spans = InlineTokenizer.tokenize(
                "This is **text** with an _italic_ word and a `code block` and an "
                        + "![obi wan image](https://i.imgur.com/fJRm4Vk.jpeg) and a [link](https://boot.dev)");

        assertEquals(List.of(
                new TextSpan("This is ", TextType.TEXT),
                new TextSpan("text", TextType.BOLD),
                new TextSpan(" with an ", TextType.TEXT),
                new TextSpan("italic", TextType.ITALIC),
                new TextSpan(" word and a ", TextType.TEXT),
                new TextSpan("code block", TextType.CODE),
                new TextSpan(" and an ", TextType.TEXT),
                new TextSpan("obi wan image", TextType.IMAGE, "https://i.imgur.com/fJRm4Vk.jpeg"),
                new TextSpan(" and a ", TextType.TEXT),
                new TextSpan("link", TextType.LINK, "https://boot.dev")), spans);
    }

    @Test
    void tokenize_emptyTextYieldsSingleEmptyPlainSpan() {
        assertEquals(List.of(TextSpan.plain("")), InlineTokenizer.tokenize(""));
    }

    @Test
    void tokenize_plainTextPassesThrough() {
        assertEquals(List.of(TextSpan.plain("nothing special here")), InlineTokenizer.tokenize("nothing special here"));
    }

    @Test
    void tokenize_concatenationDropsOnlyDelimiters() {
        String text = "**Bold** start, _it_ middle and `code` end with **more bold**";
        String joined = InlineTokenizer.tokenize(text).stream()
                .map(TextSpan::getText)
                .collect(Collectors.joining());

        assertEquals(text.replace("**", "").replace("_", "").replace("`", ""), joined);
    }

    @ParameterizedTest
    @ValueSource(strings = {"an **unclosed bold", "one _ underscore", "a `tick", "**a** and **b"})
    void tokenize_oddDelimiterCountFails(String text) {
        assertThrows(UnclosedDelimiterException.class, () -> InlineTokenizer.tokenize(text));
    }

    @Test
    void splitDelimiter_keepsEmptyEdgeSpans() {
        List<TextSpan> spans = InlineTokenizer.splitDelimiter(List.of(TextSpan.plain("**bold**")), "**", TextType.BOLD);

        assertEquals(List.of(
                new TextSpan("", TextType.TEXT),
                new TextSpan("bold", TextType.BOLD),
                new TextSpan("", TextType.TEXT)), spans);
    }

    @Test
    void splitDelimiter_reportsDelimiter() {
        UnclosedDelimiterException e = assertThrows(UnclosedDelimiterException.class,
                () -> InlineTokenizer.splitDelimiter(List.of(TextSpan.plain("a `b")), "`", TextType.CODE));
        assertEquals("`", e.getDelimiter());
    }

    @Test
    void splitDelimiter_leavesStyledSpansAlone() {
        TextSpan bold = new TextSpan("already _styled_", TextType.BOLD);
        List<TextSpan> spans = InlineTokenizer.splitDelimiter(List.of(bold), "_", TextType.ITALIC);

        assertEquals(1, spans.size());
        assertSame(bold, spans.get(0));
    }

    @Test
    void splitDelimiter_withoutOccurrencesKeepsSameInstance() {
        TextSpan plain = TextSpan.plain("no delimiters");
        assertSame(plain, InlineTokenizer.splitDelimiter(List.of(plain), "**", TextType.BOLD).get(0));
    }

    @Test
    void splitImages_multipleImages() {
        List<TextSpan> spans = InlineTokenizer.splitImages(List.of(TextSpan.plain(
                "This is text with an ![image](https://i.imgur.com/zjjcJKZ.png) and another ![second image](https://i.imgur.com/3elNhQu.png)")));

        assertEquals(List.of(
                new TextSpan("This is text with an ", TextType.TEXT),
                new TextSpan("image", TextType.IMAGE, "https://i.imgur.com/zjjcJKZ.png"),
                new TextSpan(" and another ", TextType.TEXT),
                new TextSpan("second image", TextType.IMAGE, "https://i.imgur.com/3elNhQu.png")), spans);
    }

    @Test
    void splitImages_noLeadingEmptySpan() {
        List<TextSpan> spans = InlineTokenizer.splitImages(List.of(TextSpan.plain("![alt](/a.png) after")));

        assertEquals(List.of(
                new TextSpan("alt", TextType.IMAGE, "/a.png"),
                new TextSpan(" after", TextType.TEXT)), spans);
    }

    @Test
    void splitImages_withoutMatchKeepsSameInstance() {
        TextSpan plain = TextSpan.plain("no images, just a [link](/x)");
        assertSame(plain, InlineTokenizer.splitImages(List.of(plain)).get(0));

        TextSpan empty = TextSpan.plain("");
        assertSame(empty, InlineTokenizer.splitImages(List.of(empty)).get(0));
    }

    @Test
    void splitLinks_withoutMatchKeepsSameInstance() {
        TextSpan plain = TextSpan.plain("only an ![image](/i.png) here");
        assertSame(plain, InlineTokenizer.splitLinks(List.of(plain)).get(0));

        TextSpan empty = TextSpan.plain("");
        assertSame(empty, InlineTokenizer.splitLinks(List.of(empty)).get(0));
    }

    @Test
    void splitLinks_ignoresImages() {
        List<TextSpan> spans = InlineTokenizer.splitLinks(List.of(TextSpan.plain("![img](/i.png) and [to boot dev](https://www.boot.dev)")));

        assertEquals(List.of(
                new TextSpan("![img](/i.png) and ", TextType.TEXT),
                new TextSpan("to boot dev", TextType.LINK, "https://www.boot.dev")), spans);
    }

    @Test
    void splitLinks_emptyUrl() {
        List<TextSpan> spans = InlineTokenizer.splitLinks(List.of(TextSpan.plain("[nowhere]()")));
        assertEquals(List.of(new TextSpan("nowhere", TextType.LINK, "")), spans);
    }

    @Test
    void extractImages() {
        assertEquals(List.of(new InlineReference("image", "https://i.imgur.com/zjjcJKZ.png")),
                InlineTokenizer.extractImages("This is text with an ![image](https://i.imgur.com/zjjcJKZ.png)"));
    }

    @Test
    void extractLinks_excludesImages() {
        assertEquals(List.of(
                        new InlineReference("to boot dev", "https://www.boot.dev"),
                        new InlineReference("to youtube", "https://www.youtube.com/@bootdotdev")),
                InlineTokenizer.extractLinks("![skip](/s.png) with a link [to boot dev](https://www.boot.dev) "
                        + "and [to youtube](https://www.youtube.com/@bootdotdev)"));
    }
}
