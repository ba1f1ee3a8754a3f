package com.deepansh.chatagent.tool;

/**
 * What a tool hands back: either text for the session context, or the
 * marker a terminal tool returns after delivering messages itself.
 */
public final class ToolResult {

    private final String text;
    private final int deliveredCount;
    private final boolean delivered;

    private ToolResult(String text, int deliveredCount, boolean delivered) {
        this.text = text;
        this.deliveredCount = deliveredCount;
        this.delivered = delivered;
    }

    public static ToolResult text(String text) {
        return new ToolResult(text != null ? text : "", 0, false);
    }

    public static ToolResult delivered(int count) {
        return new ToolResult(null, count, true);
    }

    public String getText() {
        return text;
    }

    public boolean isDelivered() {
        return delivered;
    }

    public int getDeliveredCount() {
        return deliveredCount;
    }

    @Override
    public String toString() {
        return delivered ? "ToolResult[delivered=" + deliveredCount + "]" : "ToolResult[text]";
    }
}
