package com.contentorganizer.bot.conversation;

import com.contentorganizer.bot.db.MessageDao;
import com.contentorganizer.bot.db.StoreException;
import com.contentorganizer.bot.db.TagDao;
import com.contentorganizer.bot.model.Tag;
import com.contentorganizer.bot.ui.TagPicker;
import com.contentorganizer.bot.ui.TagPickerRenderer;
import com.contentorganizer.bot.ui.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Two-turn tagging exchange: a picker goes out after a message is saved, and
 * the next reply or button press commits a tag to that message.
 *
 * <p>Nothing is kept between turns. The second turn rebuilds its context from
 * the prompt the user replied to or the button data, via {@link ConversationCodec}.
 * A numeric reply indexes the user's tags as they are at reply time, so it can
 * hit a different tag if the list changed after the prompt was sent.
 *
 * <p>Every call sends exactly one user-visible message (a button commit also
 * edits the picker) and never throws.
 */
public final class TagSelectionStateMachine {
    private static final Logger log = LoggerFactory.getLogger(TagSelectionStateMachine.class);

    private static final Pattern INDEX = Pattern.compile("[+-]?\\d+");

    /** Longest tag name in code points; also Telegram's button label limit. */
    public static final int MAX_TAG_NAME_LENGTH = 64;

    private final MessageDao messageDao;
    private final TagDao tagDao;
    private final ConversationCodec codec;
    private final TagPickerRenderer renderer;
    private final ChatGateway gateway;

    public TagSelectionStateMachine(MessageDao messageDao,
                                    TagDao tagDao,
                                    ConversationCodec codec,
                                    ChatGateway gateway) {
        this.messageDao = messageDao;
        this.tagDao = tagDao;
        this.codec = codec;
        this.renderer = new TagPickerRenderer(codec);
        this.gateway = gateway;
    }

    /**
     * Sends the tag picker for a freshly saved message.
     */
    public TagOutcome prompt(long chatId, long userId, int telegramMessageId) {
        List<Tag> tags;
        try {
            tags = tagDao.listForUser(userId);
        } catch (StoreException e) {
            log.error("Loading tags for user {} failed: {}", userId, e.getMessage(), e);
            return fail(chatId, TagOutcome.Failure.STORE, Texts.TAGS_LOAD_FAILED);
        }

        TagPicker picker = renderer.render(tags, telegramMessageId);
        send(chatId, picker.text, telegramMessageId, picker.markup);
        log.debug("Picker sent to user {} for message {} ({} tags, {})", userId, telegramMessageId, tags.size(), picker.mode);
        return TagOutcome.awaiting();
    }

    /**
     * Reply path: {@code replyText} answers the picker whose text is {@code promptText}.
     * The reply is a 1-based index into the tag list or a tag name.
     */
    public TagOutcome onReply(long chatId, long userId, String promptText, String replyText) {
        long originalId;
        try {
            originalId = codec.decodePrompt(promptText);
        } catch (ConversationParseException e) {
            log.warn("Reply from user {} has no usable marker: {}", userId, e.getMessage());
            return fail(chatId, TagOutcome.Failure.PARSE, Texts.ORIGINAL_NOT_FOUND);
        }

        try {
            Optional<Long> messageRowId = messageDao.resolveId(userId, originalId);
            if (messageRowId.isEmpty()) {
                log.warn("Message {} not found for user {}", originalId, userId);
                return fail(chatId, TagOutcome.Failure.NOT_FOUND, Texts.ORIGINAL_NOT_FOUND);
            }

            String tagName = replyText == null ? "" : replyText.trim();
            if (tagName.isEmpty()) {
                return fail(chatId, TagOutcome.Failure.VALIDATION, Texts.EMPTY_TAG_NAME);
            }
            // pickers list every name and must fit in one Telegram message
            if (tagName.codePointCount(0, tagName.length()) > MAX_TAG_NAME_LENGTH) {
                return fail(chatId, TagOutcome.Failure.VALIDATION,
                        String.format(Texts.TAG_NAME_TOO_LONG, MAX_TAG_NAME_LENGTH));
            }

            if (INDEX.matcher(tagName).matches()) {
                List<Tag> tags = tagDao.listForUser(userId);
                int index = toIndex(tagName, tags.size());
                if (index < 0) {
                    return fail(chatId, TagOutcome.Failure.VALIDATION, Texts.INVALID_TAG_NUMBER);
                }
                tagName = tags.get(index).name;
            }

            long tagId = tagDao.getOrCreate(userId, tagName);
            tagDao.link(messageRowId.get(), tagId);

            log.info("Message {} of user {} tagged with '{}' (reply)", originalId, userId, tagName);
            send(chatId, String.format(Texts.TAGGED_CONFIRMATION, tagName), null, null);
            return TagOutcome.resolved(tagName);
        } catch (StoreException e) {
            log.error("Tagging message {} for user {} failed: {}", originalId, userId, e.getMessage(), e);
            return fail(chatId, TagOutcome.Failure.STORE, Texts.TAG_SAVE_FAILED);
        }
    }

    /**
     * Button path. The callback is always answered first.
     *
     * @param pickerMessageId the picker holding the pressed button, null if unavailable
     */
    public TagOutcome onCallback(String callbackQueryId, long chatId, Integer pickerMessageId, long userId, String data) {
        answer(callbackQueryId);
        log.debug("Callback from user {}: {}", userId, data);

        CallbackPayload payload;
        try {
            payload = codec.decodeCallback(data);
        } catch (ConversationParseException e) {
            log.warn("Bad callback data from user {}: {}", userId, e.getMessage());
            return fail(chatId, TagOutcome.Failure.PARSE, Texts.ORIGINAL_NOT_FOUND);
        }

        return switch (payload.kind) {
            case NEW_TAG -> askForNewTagName(chatId, pickerMessageId, payload.messageId);
            case TAG -> commitChosenTag(chatId, pickerMessageId, userId, payload.tagId, payload.messageId);
        };
    }

    private TagOutcome askForNewTagName(long chatId, Integer pickerMessageId, long originalId) {
        TagPicker prompt = renderer.newTagPrompt(originalId);
        send(chatId, prompt.text, null, prompt.markup);
        edit(chatId, pickerMessageId, Texts.NEW_TAG_WAITING);
        return TagOutcome.awaiting();
    }

    private TagOutcome commitChosenTag(long chatId, Integer pickerMessageId, long userId, long tagId, long originalId) {
        try {
            Optional<Long> messageRowId = messageDao.resolveId(userId, originalId);
            if (messageRowId.isEmpty()) {
                log.warn("Message {} not found for user {}", originalId, userId);
                return fail(chatId, TagOutcome.Failure.NOT_FOUND, Texts.ORIGINAL_NOT_FOUND);
            }

            // scoped by user: a tag id from someone else's keyboard resolves to nothing
            Optional<String> tagName = tagDao.findName(tagId, userId);
            if (tagName.isEmpty()) {
                log.warn("Tag {} not found for user {}", tagId, userId);
                return fail(chatId, TagOutcome.Failure.NOT_FOUND, Texts.ORIGINAL_NOT_FOUND);
            }

            tagDao.link(messageRowId.get(), tagId);

            log.info("Message {} of user {} tagged with '{}' (button)", originalId, userId, tagName.get());
            send(chatId, String.format(Texts.TAGGED_CONFIRMATION, tagName.get()), null, null);
            edit(chatId, pickerMessageId, String.format(Texts.TAGGED_PICKER, tagName.get()));
            return TagOutcome.resolved(tagName.get());
        } catch (StoreException e) {
            log.error("Tagging message {} for user {} failed: {}", originalId, userId, e.getMessage(), e);
            return fail(chatId, TagOutcome.Failure.STORE, Texts.TAG_SAVE_FAILED);
        }
    }

    /* ---------------------------
       Helpers
       --------------------------- */

    /** Zero-based position, or -1 when the number is outside 1..size. */
    private static int toIndex(String number, int size) {
        String digits = number.startsWith("+") ? number.substring(1) : number;
        if (digits.startsWith("-") || digits.length() > 9) return -1;
        int n = Integer.parseInt(digits);
        if (n < 1 || n > size) return -1;
        return n - 1;
    }

    private TagOutcome fail(long chatId, TagOutcome.Failure failure, String text) {
        send(chatId, text, null, null);
        return TagOutcome.failed(failure);
    }

    private void send(long chatId, String text, Integer replyTo, ReplyKeyboard markup) {
        try {
            gateway.send(chatId, text, replyTo, markup);
        } catch (TelegramApiException e) {
            log.warn("Send to chat {} failed: {}", chatId, e.getMessage());
        }
    }

    private void edit(long chatId, Integer messageId, String text) {
        if (messageId == null) return;
        try {
            gateway.editText(chatId, messageId, text);
        } catch (TelegramApiException e) {
            log.warn("Edit of message {} in chat {} failed: {}", messageId, chatId, e.getMessage());
        }
    }

    private void answer(String callbackQueryId) {
        try {
            gateway.answerCallback(callbackQueryId);
        } catch (TelegramApiException e) {
            log.warn("Answering callback {} failed: {}", callbackQueryId, e.getMessage());
        }
    }
}
