package org.dxworks.sitegen.model.text;

public enum TextType {
    TEXT("text"),
    BOLD("bold"),
    ITALIC("italic"),
    CODE("code"),
    LINK("link"),
    IMAGE("image");

    private final String name;

    TextType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
