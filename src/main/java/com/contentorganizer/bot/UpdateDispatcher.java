package com.contentorganizer.bot;

import com.contentorganizer.bot.conversation.ChatGateway;
import com.contentorganizer.bot.conversation.ConversationCodec;
import com.contentorganizer.bot.conversation.TagSelectionStateMachine;
import com.contentorganizer.bot.db.DuplicateMessageException;
import com.contentorganizer.bot.db.MessageDao;
import com.contentorganizer.bot.db.StoreException;
import com.contentorganizer.bot.db.UserDao;
import com.contentorganizer.bot.extract.MetadataExtractor;
import com.contentorganizer.bot.model.MessageMetadata;
import com.contentorganizer.bot.ui.Keyboards;
import com.contentorganizer.bot.ui.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Locale;
import java.util.Optional;

/**
 * Routes one update: commands, replies to a tag picker, button presses, and
 * everything else as new content to save and tag.
 */
public final class UpdateDispatcher {
    private static final Logger log = LoggerFactory.getLogger(UpdateDispatcher.class);

    private final UserDao userDao;
    private final MessageDao messageDao;
    private final TagSelectionStateMachine stateMachine;
    private final ConversationCodec codec;
    private final ChatGateway gateway;
    private final String miniAppUrl;

    public UpdateDispatcher(UserDao userDao,
                            MessageDao messageDao,
                            TagSelectionStateMachine stateMachine,
                            ConversationCodec codec,
                            ChatGateway gateway,
                            String miniAppUrl) {
        this.userDao = userDao;
        this.messageDao = messageDao;
        this.stateMachine = stateMachine;
        this.codec = codec;
        this.gateway = gateway;
        this.miniAppUrl = miniAppUrl;
    }

    public void handle(Update update) {
        if (update.hasMessage()) {
            handleMessage(update.getMessage());
            return;
        }
        if (update.hasCallbackQuery()) {
            handleCallback(update.getCallbackQuery());
        }
    }

    private void handleMessage(Message message) {
        User from = message.getFrom();
        if (from == null) return;

        long chatId = message.getChatId();
        Optional<Long> userId = ensureUser(from);
        if (userId.isEmpty()) {
            send(chatId, Texts.GENERIC_FAILURE, message.getMessageId(), null);
            return;
        }

        String text = message.getText();
        if (isCommand(message)) {
            handleCommand(chatId, message.getMessageId(), commandName(text));
            return;
        }

        if (isPickerReply(message)) {
            stateMachine.onReply(chatId, userId.get(), message.getReplyToMessage().getText(), text);
            return;
        }

        ingest(chatId, userId.get(), message);
    }

    private void handleCallback(CallbackQuery cq) {
        Message picker = cq.getMessage();
        Optional<Long> userId = ensureUser(cq.getFrom());

        if (picker == null || userId.isEmpty()) {
            // no chat to answer in, or no user row: just stop the spinner
            try {
                gateway.answerCallback(cq.getId());
            } catch (TelegramApiException e) {
                log.warn("Answering callback {} failed: {}", cq.getId(), e.getMessage());
            }
            if (picker != null) {
                send(picker.getChatId(), Texts.GENERIC_FAILURE, null, null);
            }
            return;
        }

        stateMachine.onCallback(cq.getId(), picker.getChatId(), picker.getMessageId(), userId.get(), cq.getData());
    }

    /* ---------------------------
       Core flow
       --------------------------- */

    private void ingest(long chatId, long userId, Message message) {
        MessageMetadata meta = MetadataExtractor.extract(message);
        try {
            messageDao.save(userId, message.getMessageId(), meta);
        } catch (DuplicateMessageException e) {
            log.info("Message {} of user {} already stored", message.getMessageId(), userId);
            send(chatId, Texts.ALREADY_SAVED, message.getMessageId(), null);
            return;
        } catch (StoreException e) {
            log.error("Saving message {} for user {} failed: {}", message.getMessageId(), userId, e.getMessage(), e);
            send(chatId, Texts.SAVE_FAILED, message.getMessageId(), null);
            return;
        }

        log.info("Saved {} message {} for user {} (urls={}, hashtags={}, mentions={})",
                meta.type.dbValue(), message.getMessageId(), userId,
                meta.urls.size(), meta.hashtags.size(), meta.mentions.size());

        stateMachine.prompt(chatId, userId, message.getMessageId());
    }

    private void handleCommand(long chatId, Integer messageId, String command) {
        switch (command) {
            case "start" -> send(chatId, Texts.START, messageId, null);
            case "help" -> send(chatId, Texts.HELP, messageId, null);
            case "miniapp" -> {
                if (miniAppUrl == null) {
                    send(chatId, Texts.MINIAPP_NOT_CONFIGURED, messageId, null);
                } else {
                    send(chatId, Texts.MINIAPP_PROMPT, null, Keyboards.singleUrlButton(Texts.MINIAPP_BUTTON, miniAppUrl));
                }
            }
            default -> send(chatId, Texts.UNKNOWN_COMMAND, messageId, null);
        }
    }

    /* ---------------------------
       Helpers
       --------------------------- */

    private Optional<Long> ensureUser(User from) {
        try {
            return Optional.of(userDao.upsert(from.getId(), from.getUserName(), from.getFirstName(), from.getLastName()));
        } catch (StoreException e) {
            log.error("Saving user {} failed: {}", from.getId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private boolean isPickerReply(Message message) {
        Message replied = message.getReplyToMessage();
        if (replied == null || replied.getFrom() == null) return false;
        if (!Boolean.TRUE.equals(replied.getFrom().getIsBot())) return false;
        return codec.isPrompt(replied.getText());
    }

    // forwarded text starting with '/' is content, not a command
    private static boolean isCommand(Message message) {
        String text = message.getText();
        if (text == null || !text.startsWith("/") || text.length() < 2) return false;
        return message.getForwardDate() == null;
    }

    /** "/start@MyBot payload" -> "start" */
    static String commandName(String text) {
        String head = text.trim().split("\\s+", 2)[0].substring(1);
        int at = head.indexOf('@');
        if (at >= 0) head = head.substring(0, at);
        return head.toLowerCase(Locale.ROOT);
    }

    private void send(long chatId, String text, Integer replyTo, ReplyKeyboard markup) {
        try {
            gateway.send(chatId, text, replyTo, markup);
        } catch (TelegramApiException e) {
            log.warn("Send to chat {} failed: {}", chatId, e.getMessage());
        }
    }
}
