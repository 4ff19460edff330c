package com.contentorganizer.bot.conversation;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Outbound side of the chat.
 */
public interface ChatGateway {

    void send(long chatId, String text, Integer replyToMessageId, ReplyKeyboard markup) throws TelegramApiException;

    void editText(long chatId, int messageId, String text) throws TelegramApiException;

    void answerCallback(String callbackQueryId) throws TelegramApiException;
}
