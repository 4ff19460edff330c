package com.contentorganizer.bot;

import com.contentorganizer.bot.config.BotConfig;
import com.contentorganizer.bot.conversation.ChatGateway;
import com.contentorganizer.bot.conversation.ConversationCodec;
import com.contentorganizer.bot.conversation.ReplyChainCodec;
import com.contentorganizer.bot.conversation.TagSelectionStateMachine;
import com.contentorganizer.bot.db.MessageDao;
import com.contentorganizer.bot.db.TagDao;
import com.contentorganizer.bot.db.UserDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

public final class ContentOrganizerBot extends TelegramLongPollingBot implements ChatGateway {
    private static final Logger log = LoggerFactory.getLogger(ContentOrganizerBot.class);

    private final BotConfig config;
    private final UpdateDispatcher dispatcher;

    public ContentOrganizerBot(BotConfig config, UserDao userDao, MessageDao messageDao, TagDao tagDao) {
        super(config.botToken);
        this.config = config;

        ConversationCodec codec = new ReplyChainCodec();
        TagSelectionStateMachine stateMachine = new TagSelectionStateMachine(messageDao, tagDao, codec, this);
        this.dispatcher = new UpdateDispatcher(userDao, messageDao, stateMachine, codec, this, config.miniAppUrl);
    }

    @Override
    public String getBotUsername() {
        return config.botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            dispatcher.handle(update);
        } catch (Exception e) {
            log.error("onUpdateReceived error: {}", e.getMessage(), e);
        }
    }

    /* ---------------------------
       ChatGateway
       --------------------------- */

    @Override
    public void send(long chatId, String text, Integer replyToMessageId, ReplyKeyboard markup) throws TelegramApiException {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(chatId));
        msg.setText(text);
        if (replyToMessageId != null) msg.setReplyToMessageId(replyToMessageId);
        if (markup != null) msg.setReplyMarkup(markup);
        msg.setDisableWebPagePreview(true);
        execute(msg);
    }

    @Override
    public void editText(long chatId, int messageId, String text) throws TelegramApiException {
        EditMessageText edit = new EditMessageText();
        edit.setChatId(String.valueOf(chatId));
        edit.setMessageId(messageId);
        edit.setText(text);
        execute(edit);
    }

    @Override
    public void answerCallback(String callbackQueryId) throws TelegramApiException {
        AnswerCallbackQuery ans = new AnswerCallbackQuery();
        ans.setCallbackQueryId(callbackQueryId);
        execute(ans);
    }
}
