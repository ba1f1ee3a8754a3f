package com.deepansh.chatagent.chat;

/**
 * @param markdown         render the text with platform markup
 * @param replyToMessageId thread the message under this one; null for none
 */
public record SendOptions(boolean markdown, String replyToMessageId) {

    public static final SendOptions PLAIN = new SendOptions(false, null);

    public static SendOptions markdown(String replyToMessageId) {
        return new SendOptions(true, replyToMessageId);
    }

    public static SendOptions plainReply(String replyToMessageId) {
        return new SendOptions(false, replyToMessageId);
    }
}
