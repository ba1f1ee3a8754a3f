package com.deepansh.chatagent.delivery;

import java.util.regex.Pattern;

/**
 * Reduces Markdown to plain text for the fallback send after the platform
 * rejected a formatted message.
 */
public final class MarkupStripper {

    private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)]\\(([^)]*)\\)");
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*|__(.+?)__");
    private static final Pattern EMPHASIS = Pattern.compile("(?<![\\w*])\\*(?!\\s)(.+?)(?<!\\s)\\*(?![\\w*])|(?<!\\w)_(?!\\s)(.+?)(?<!\\s)_(?!\\w)");
    private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z0-9]*\\n?");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]*)`");
    private static final Pattern HEADING = Pattern.compile("(?m)^#{1,6}\\s+");

    private MarkupStripper() {
    }

    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String out = LINK.matcher(text).replaceAll("$1");
        out = CODE_FENCE.matcher(out).replaceAll("");
        out = INLINE_CODE.matcher(out).replaceAll("$1");
        out = BOLD.matcher(out).replaceAll(m -> quote(m.group(1) != null ? m.group(1) : m.group(2)));
        out = EMPHASIS.matcher(out).replaceAll(m -> quote(m.group(1) != null ? m.group(1) : m.group(2)));
        out = HEADING.matcher(out).replaceAll("");
        return out.strip();
    }

    private static String quote(String s) {
        return s.replace("\\", "\\\\").replace("$", "\\$");
    }
}
