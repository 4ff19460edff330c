package com.contentorganizer.bot.model;

import java.util.Locale;

public enum MessageType {
    TEXT,
    PHOTO,
    VIDEO,
    DOCUMENT,
    AUDIO,
    VOICE,
    VIDEO_NOTE,
    STICKER;

    /** Value stored in messages.message_type, e.g. "video_note". */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageType fromDbValue(String value) {
        return MessageType.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
