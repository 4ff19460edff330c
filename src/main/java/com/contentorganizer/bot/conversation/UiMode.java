package com.contentorganizer.bot.conversation;

public enum UiMode {
    /** Inline keyboard, two tags per row. */
    BUTTONS,
    /** Numbered list answered with a forced reply. */
    TEXT
}
