package com.contentorganizer.bot.conversation;

public final class CallbackPayload {
    public enum Kind {
        TAG,
        NEW_TAG
    }

    public final Kind kind;
    public final Long tagId;        // null for NEW_TAG
    public final long messageId;    // Telegram id of the message being tagged

    private CallbackPayload(Kind kind, Long tagId, long messageId) {
        this.kind = kind;
        this.tagId = tagId;
        this.messageId = messageId;
    }

    public static CallbackPayload tag(long tagId, long messageId) {
        return new CallbackPayload(Kind.TAG, tagId, messageId);
    }

    public static CallbackPayload newTag(long messageId) {
        return new CallbackPayload(Kind.NEW_TAG, null, messageId);
    }
}
