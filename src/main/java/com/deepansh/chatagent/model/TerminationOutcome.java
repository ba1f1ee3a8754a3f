package com.deepansh.chatagent.model;

/**
 * How a session ended. PENDING is the only non-terminal kind.
 *
 * @param kind      outcome tag
 * @param text      final answer, for FINAL_CONTENT
 * @param error     failure description, for FAILED
 * @param delivered messages already sent by a terminal tool, for MESSAGES_DELIVERED
 */
public record TerminationOutcome(Kind kind, String text, String error, int delivered) {

    public enum Kind {
        PENDING, FINAL_CONTENT, MESSAGES_DELIVERED, TIMED_OUT, CANCELLED, FAILED
    }

    public static final TerminationOutcome PENDING = new TerminationOutcome(Kind.PENDING, null, null, 0);
    public static final TerminationOutcome TIMED_OUT = new TerminationOutcome(Kind.TIMED_OUT, null, null, 0);
    public static final TerminationOutcome CANCELLED = new TerminationOutcome(Kind.CANCELLED, null, null, 0);

    public static TerminationOutcome finalContent(String text) {
        return new TerminationOutcome(Kind.FINAL_CONTENT, text, null, 0);
    }

    public static TerminationOutcome messagesDelivered(int count) {
        return new TerminationOutcome(Kind.MESSAGES_DELIVERED, null, null, count);
    }

    public static TerminationOutcome failed(String error) {
        return new TerminationOutcome(Kind.FAILED, null, error, 0);
    }

    public boolean isTerminal() {
        return kind != Kind.PENDING;
    }
}
