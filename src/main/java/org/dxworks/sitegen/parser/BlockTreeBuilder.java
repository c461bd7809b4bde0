package org.dxworks.sitegen.parser;

import org.dxworks.sitegen.model.block.BlockType;
import org.dxworks.sitegen.model.html.HtmlNode;
import org.dxworks.sitegen.model.html.LeafNode;
import org.dxworks.sitegen.model.html.ParentNode;
import org.dxworks.sitegen.model.text.TextSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns classified markdown blocks into HTML nodes and a whole document into a single
 * {@code div}.
 */
public final class BlockTreeBuilder {

    private static final String ORDERED_MARKER_SEPARATOR = ". ";

    private BlockTreeBuilder() {}

    public static ParentNode buildDocument(String markdown) {
        List<HtmlNode> blockNodes = new ArrayList<>();
        for (String block : BlockSegmenter.segment(markdown)) {
            blockNodes.add(buildBlock(block));
        }
        return new ParentNode("div", blockNodes);
    }

    public static ParentNode buildBlock(String block) {
        return buildBlock(block, BlockSegmenter.classify(block));
    }

    public static ParentNode buildBlock(String block, BlockType type) {
        return switch (type) {
            case PARAGRAPH -> new ParentNode("p", textToChildren(block.replace("\n", " ")));
            case HEADING -> buildHeading(block);
            case CODE -> buildCode(block);
            case QUOTE -> buildQuote(block);
            case UNORDERED_LIST -> buildUnorderedList(block);
            case ORDERED_LIST -> buildOrderedList(block);
        };
    }

    public static List<LeafNode> textToChildren(String text) {
        List<LeafNode> children = new ArrayList<>();
        for (TextSpan span : InlineTokenizer.tokenize(text)) {
            children.add(toHtmlNode(span));
        }
        return children;
    }

    public static LeafNode toHtmlNode(TextSpan span) {
        if (span.getTextType() == null) {
            throw new UnknownSpanTypeException(null);
        }
        return switch (span.getTextType()) {
            case TEXT -> new LeafNode(null, span.getText());
            case BOLD -> new LeafNode("b", span.getText());
            case ITALIC -> new LeafNode("i", span.getText());
            case CODE -> new LeafNode("code", span.getText());
            case LINK -> new LeafNode("a", span.getText(), Map.of("href", orEmpty(span.getUrl())));
            case IMAGE -> {
                Map<String, String> attributes = new LinkedHashMap<>();
                attributes.put("src", orEmpty(span.getUrl()));
                attributes.put("alt", span.getText());
                yield new LeafNode("img", "", attributes);
            }
        };
    }

    private static ParentNode buildHeading(String block) {
        int level = BlockSegmenter.headingLevel(block);
        return new ParentNode("h" + level, textToChildren(block.substring(level + 1)));
    }

    private static ParentNode buildCode(String block) {
        String fence = BlockSegmenter.CODE_FENCE;
        // content is the exact text between "```\n" and the closing "```"
        String content = block.substring(fence.length() + 1, block.length() - fence.length());
        return new ParentNode("pre", List.of(new LeafNode("code", content)));
    }

    private static ParentNode buildQuote(String block) {
        List<String> stripped = new ArrayList<>();
        for (String line : BlockSegmenter.lines(block)) {
            String rest = line.startsWith(">") ? line.substring(1) : line;
            stripped.add(rest.strip());
        }
        return new ParentNode("blockquote", textToChildren(String.join(" ", stripped)));
    }

    private static ParentNode buildUnorderedList(String block) {
        List<ParentNode> items = new ArrayList<>();
        for (String line : BlockSegmenter.lines(block)) {
            items.add(new ParentNode("li", textToChildren(line.substring(2))));
        }
        return new ParentNode("ul", items);
    }

    private static ParentNode buildOrderedList(String block) {
        List<ParentNode> items = new ArrayList<>();
        for (String line : BlockSegmenter.lines(block)) {
            int markerEnd = line.indexOf(ORDERED_MARKER_SEPARATOR) + ORDERED_MARKER_SEPARATOR.length();
            items.add(new ParentNode("li", textToChildren(line.substring(markerEnd))));
        }
        return new ParentNode("ol", items);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
