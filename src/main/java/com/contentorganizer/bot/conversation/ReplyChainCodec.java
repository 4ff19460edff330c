package com.contentorganizer.bot.conversation;

import java.util.List;

/**
 * Text formats:
 * <ul>
 *     <li>prompt marker: {@code [MSG_ID:<id>]} at the end of the prompt</li>
 *     <li>existing tag button: {@code tag:<tagId>:<msgId>}</li>
 *     <li>new tag button: {@code new_tag:<msgId>}</li>
 * </ul>
 */
public final class ReplyChainCodec implements ConversationCodec {
    public static final String MARKER_OPEN = "[MSG_ID:";
    public static final String MARKER_CLOSE = "]";

    static final String TAG_PREFIX = "tag";
    static final String NEW_TAG_PREFIX = "new_tag";

    // prompts sent before the marker was added to every picker
    private static final List<String> PROMPT_PHRASES = List.of(
            "Choose by typing",
            "Choose a tag by typing",
            "You don't have any tags yet",
            "Please reply with the name for your new tag"
    );

    @Override
    public String encodePrompt(String promptText, long messageId) {
        return promptText + "\n\n" + MARKER_OPEN + messageId + MARKER_CLOSE;
    }

    @Override
    public long decodePrompt(String promptText) throws ConversationParseException {
        if (promptText == null) {
            throw new ConversationParseException("No prompt text");
        }
        // last one wins: tag names listed above the marker may look like markers too
        int open = promptText.lastIndexOf(MARKER_OPEN);
        if (open < 0) {
            throw new ConversationParseException("Marker not found");
        }
        int start = open + MARKER_OPEN.length();
        int close = promptText.indexOf(MARKER_CLOSE, start);
        if (close < 0) {
            throw new ConversationParseException("Marker is not closed");
        }
        return parseId(promptText.substring(start, close));
    }

    @Override
    public boolean isPrompt(String text) {
        if (text == null) return false;
        if (text.contains(MARKER_OPEN)) return true;
        for (String phrase : PROMPT_PHRASES) {
            if (text.contains(phrase)) return true;
        }
        return false;
    }

    @Override
    public String encodeTagChoice(long tagId, long messageId) {
        return TAG_PREFIX + ":" + tagId + ":" + messageId;
    }

    @Override
    public String encodeNewTag(long messageId) {
        return NEW_TAG_PREFIX + ":" + messageId;
    }

    @Override
    public CallbackPayload decodeCallback(String data) throws ConversationParseException {
        if (data == null || data.isEmpty()) {
            throw new ConversationParseException("Empty callback data");
        }
        String[] parts = data.split(":", -1);
        switch (parts[0]) {
            case TAG_PREFIX -> {
                if (parts.length != 3) {
                    throw new ConversationParseException("Invalid tag callback data: " + data);
                }
                return CallbackPayload.tag(parseId(parts[1]), parseId(parts[2]));
            }
            case NEW_TAG_PREFIX -> {
                if (parts.length != 2) {
                    throw new ConversationParseException("Invalid new_tag callback data: " + data);
                }
                return CallbackPayload.newTag(parseId(parts[1]));
            }
            default -> throw new ConversationParseException("Unknown callback data: " + data);
        }
    }

    private static long parseId(String raw) throws ConversationParseException {
        if (raw.isEmpty()) {
            throw new ConversationParseException("Empty id");
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                throw new ConversationParseException("Non-numeric id: " + raw);
            }
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConversationParseException("Id out of range: " + raw, e);
        }
    }
}
