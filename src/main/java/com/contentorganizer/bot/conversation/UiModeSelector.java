package com.contentorganizer.bot.conversation;

public final class UiModeSelector {
    /** Inline keyboards get unwieldy past this many tags. */
    public static final int MAX_BUTTON_TAGS = 20;

    private UiModeSelector() {}

    public static UiMode chooseMode(int tagCount) {
        return tagCount <= MAX_BUTTON_TAGS ? UiMode.BUTTONS : UiMode.TEXT;
    }
}
