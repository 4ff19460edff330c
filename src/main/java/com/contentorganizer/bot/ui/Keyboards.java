package com.contentorganizer.bot.ui;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.ForceReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.ArrayList;
import java.util.List;

public final class Keyboards {
    private Keyboards() {}

    public static InlineKeyboardMarkup singleUrlButton(String text, String url) {
        InlineKeyboardMarkup m = new InlineKeyboardMarkup();
        m.setKeyboard(List.of(List.of(urlButton(text, url))));
        return m;
    }

    /**
     * Lays buttons out {@code perRow} at a time, then appends {@code trailing} on its own row.
     */
    public static InlineKeyboardMarkup grid(List<InlineKeyboardButton> buttons, int perRow, InlineKeyboardButton trailing) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (int i = 0; i < buttons.size(); i += perRow) {
            rows.add(new ArrayList<>(buttons.subList(i, Math.min(i + perRow, buttons.size()))));
        }
        if (trailing != null) {
            rows.add(List.of(trailing));
        }
        InlineKeyboardMarkup m = new InlineKeyboardMarkup();
        m.setKeyboard(rows);
        return m;
    }

    public static ForceReplyKeyboard forceReply() {
        ForceReplyKeyboard kb = new ForceReplyKeyboard();
        kb.setForceReply(true);
        kb.setSelective(true);
        return kb;
    }

    public static InlineKeyboardButton callbackButton(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setCallbackData(data);
        return b;
    }

    public static InlineKeyboardButton urlButton(String text, String url) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setUrl(url);
        return b;
    }
}
