package org.dxworks.sitegen.parser;

import org.dxworks.sitegen.model.block.BlockType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a markdown document into blocks on blank lines and classifies each block.
 */
public final class BlockSegmenter {

    static final String BLOCK_SEPARATOR = "\n\n";
    static final String CODE_FENCE = "```";

    private static final Pattern HEADING_PATTERN = Pattern.compile("^(#{1,6}) ");

    private BlockSegmenter() {}

    public static List<String> segment(String document) {
        List<String> blocks = new ArrayList<>();
        for (String part : document.split(BLOCK_SEPARATOR, -1)) {
            String block = part.strip();
            if (!block.isEmpty()) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    public static BlockType classify(String block) {
        if (block.isEmpty()) {
            return BlockType.PARAGRAPH;
        }
        if (HEADING_PATTERN.matcher(block).lookingAt()) {
            return BlockType.HEADING;
        }
        if (block.startsWith(CODE_FENCE + "\n") && block.endsWith(CODE_FENCE)) {
            return BlockType.CODE;
        }

        String[] lines = lines(block);
        if (allStartWith(lines, ">")) {
            return BlockType.QUOTE;
        }
        if (allStartWith(lines, "- ")) {
            return BlockType.UNORDERED_LIST;
        }
        if (isNumberedSequence(lines)) {
            return BlockType.ORDERED_LIST;
        }
        return BlockType.PARAGRAPH;
    }

    /**
     * @return the number of leading '#' characters of a heading block
     * @throws IllegalArgumentException if the block is not a heading
     */
    public static int headingLevel(String block) {
        Matcher matcher = HEADING_PATTERN.matcher(block);
        if (!matcher.lookingAt()) {
            throw new IllegalArgumentException("Not a heading block: " + block);
        }
        return matcher.group(1).length();
    }

    static String[] lines(String block) {
        return block.split("\n", -1);
    }

    private static boolean allStartWith(String[] lines, String prefix) {
        for (String line : lines) {
            if (!line.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    // numbering has to start at 1 and increase by exactly one per line
    private static boolean isNumberedSequence(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].startsWith((i + 1) + ". ")) {
                return false;
            }
        }
        return true;
    }
}
