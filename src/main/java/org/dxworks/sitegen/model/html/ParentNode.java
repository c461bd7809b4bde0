package org.dxworks.sitegen.model.html;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ParentNode implements HtmlNode {
    private final String tag;
    private final List<HtmlNode> children;
    private final Map<String, String> attributes;

    public ParentNode(String tag, List<? extends HtmlNode> children) {
        this(tag, children, null);
    }

    public ParentNode(String tag, List<? extends HtmlNode> children, Map<String, String> attributes) {
        this.tag = tag;
        // null children is kept as-is so that render() can report it
        this.children = children == null ? null : List.copyOf(children);
        this.attributes = attributes == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public String getTag() {
        return tag;
    }

    public List<HtmlNode> getChildren() {
        return children;
    }

    @Override
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public String render() {
        if (tag == null) {
            throw new HtmlRenderException(HtmlRenderException.Reason.MISSING_TAG, "ParentNode must have a tag");
        }
        if (children == null) {
            throw new HtmlRenderException(HtmlRenderException.Reason.MISSING_CHILDREN, "ParentNode must have children");
        }
        StringBuilder html = new StringBuilder();
        html.append('<').append(tag).append(attributesToString()).append('>');
        for (HtmlNode child : children) {
            html.append(child.render());
        }
        html.append("</").append(tag).append('>');
        return html.toString();
    }

    @Override
    public String toString() {
        return "ParentNode(tag=" + tag + ", children=" + children + ", attributes=" + attributes + ")";
    }
}
