package org.dxworks.sitegen.model.text;

import java.util.Objects;

/**
 * One run of inline text with a single style. For links and images {@code text} is the
 * anchor or alt text and {@code url} the destination, which may be null.
 */
public final class TextSpan {
    private final String text;
    private final TextType textType;
    private final String url;

    public TextSpan(String text, TextType textType) {
        this(text, textType, null);
    }

    public TextSpan(String text, TextType textType, String url) {
        this.text = text;
        this.textType = textType;
        this.url = url;
    }

    public static TextSpan plain(String text) {
        return new TextSpan(text, TextType.TEXT);
    }

    public String getText() {
        return text;
    }

    public TextType getTextType() {
        return textType;
    }

    public String getUrl() {
        return url;
    }

    public boolean isPlain() {
        return textType == TextType.TEXT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextSpan)) return false;
        TextSpan other = (TextSpan) o;
        return Objects.equals(text, other.text)
                && textType == other.textType
                && Objects.equals(url, other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, textType, url);
    }

    @Override
    public String toString() {
        return "TextSpan(" + text + ", " + (textType == null ? null : textType.getName()) + ", " + url + ")";
    }
}
