package org.dxworks.sitegen.model.html;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class LeafNode implements HtmlNode {
    private final String tag;
    private final String value;
    private final Map<String, String> attributes;

    public LeafNode(String tag, String value) {
        this(tag, value, null);
    }

    public LeafNode(String tag, String value, Map<String, String> attributes) {
        this.tag = tag;
        this.value = value;
        this.attributes = attributes == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public String getTag() {
        return tag;
    }

    public String getValue() {
        return value;
    }

    @Override
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public String render() {
        if (value == null) {
            throw new HtmlRenderException(HtmlRenderException.Reason.MISSING_VALUE, "LeafNode must have a value");
        }
        if (tag == null) {
            return value;
        }
        if (HtmlNode.isVoidTag(tag)) {
            return "<" + tag + attributesToString() + ">";
        }
        return "<" + tag + attributesToString() + ">" + value + "</" + tag + ">";
    }

    @Override
    public String toString() {
        return "LeafNode(tag=" + tag + ", value=" + value + ", attributes=" + attributes + ")";
    }
}
