package com.contentorganizer.bot.conversation;

/** Marker or callback data could not be decoded. */
public class ConversationParseException extends Exception {

    public ConversationParseException(String message) {
        super(message);
    }

    public ConversationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
