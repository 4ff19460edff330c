package com.contentorganizer.bot.ui;

import com.contentorganizer.bot.conversation.UiMode;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;

public final class TagPicker {
    public final UiMode mode;
    public final String text;
    public final ReplyKeyboard markup;

    public TagPicker(UiMode mode, String text, ReplyKeyboard markup) {
        this.mode = mode;
        this.text = text;
        this.markup = markup;
    }
}
