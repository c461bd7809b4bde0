package org.dxworks.sitegen.model.html;

public class HtmlRenderException extends IllegalStateException {

    public enum Reason {
        MISSING_VALUE,
        MISSING_TAG,
        MISSING_CHILDREN
    }

    private final Reason reason;

    public HtmlRenderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
