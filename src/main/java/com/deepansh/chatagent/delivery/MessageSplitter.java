package com.deepansh.chatagent.delivery;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits outbound text into chunks the chat platform will accept.
 *
 * Lines are kept whole where possible; a single line longer than the limit
 * is cut at the limit. Every chunk is non-empty and at most maxLength long.
 */
public final class MessageSplitter {

    private MessageSplitter() {
    }

    public static List<String> split(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean started = false;

        for (String line : text.split("\n", -1)) {
            if (line.length() > maxLength) {
                flush(chunks, current);
                started = false;
                int pos = 0;
                while (line.length() - pos > maxLength) {
                    chunks.add(line.substring(pos, pos + maxLength));
                    pos += maxLength;
                }
                current.append(line, pos, line.length());
                started = true;
                continue;
            }

            int needed = started ? current.length() + 1 + line.length() : line.length();
            if (started && needed > maxLength) {
                flush(chunks, current);
                started = false;
            }
            if (started) {
                current.append('\n');
            }
            current.append(line);
            started = true;
        }
        flush(chunks, current);
        return chunks;
    }

    /** Splits each message independently, preserving message order */
    public static List<String> splitAll(List<String> messages, int maxLength) {
        List<String> chunks = new ArrayList<>();
        for (String message : messages) {
            chunks.addAll(split(message, maxLength));
        }
        return chunks;
    }

    private static void flush(List<String> chunks, StringBuilder current) {
        String chunk = current.toString().strip();
        if (!chunk.isEmpty()) {
            chunks.add(chunk);
        }
        current.setLength(0);
    }
}
