package org.dxworks.sitegen.model.html;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A node of the generated HTML tree. Either a {@link LeafNode} holding a text value
 * or a {@link ParentNode} holding child nodes.
 */
public sealed interface HtmlNode permits LeafNode, ParentNode {

    Set<String> VOID_TAGS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img",
            "input", "link", "meta", "source", "track", "wbr");

    String getTag();

    Map<String, String> getAttributes();

    String render();

    default String attributesToString() {
        Map<String, String> attributes = getAttributes();
        if (attributes == null || attributes.isEmpty()) {
            return "";
        }
        return attributes.entrySet().stream()
                .map(e -> e.getKey() + "=\"" + e.getValue() + "\"")
                .collect(Collectors.joining(" ", " ", ""));
    }

    static boolean isVoidTag(String tag) {
        return tag != null && VOID_TAGS.contains(tag);
    }
}
