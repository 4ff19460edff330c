package com.contentorganizer.bot.conversation;

/**
 * Carries tagging context between two turns of the chat.
 *
 * <p>There is no server-side session: the id of the message being tagged
 * travels in the bot's own prompt text and in inline-button data, and is
 * read back from whatever the user replies to or presses.
 */
public interface ConversationCodec {

    /** Appends the context marker for {@code messageId} to a prompt. */
    String encodePrompt(String promptText, long messageId);

    /** Reads the message id back from a prompt the user replied to. */
    long decodePrompt(String promptText) throws ConversationParseException;

    /** True if the text looks like one of our tag-picker prompts. */
    boolean isPrompt(String text);

    String encodeTagChoice(long tagId, long messageId);

    String encodeNewTag(long messageId);

    CallbackPayload decodeCallback(String data) throws ConversationParseException;
}
