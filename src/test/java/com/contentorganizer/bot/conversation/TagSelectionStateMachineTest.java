package com.contentorganizer.bot.conversation;

import com.contentorganizer.bot.db.Database;
import com.contentorganizer.bot.db.MessageDao;
import com.contentorganizer.bot.db.TagDao;
import com.contentorganizer.bot.db.UserDao;
import com.contentorganizer.bot.model.FileDescriptor;
import com.contentorganizer.bot.model.MessageMetadata;
import com.contentorganizer.bot.model.MessageType;
import com.contentorganizer.bot.ui.Texts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ForceReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TagSelectionStateMachineTest {
    private static final long CHAT = 500L;
    private static final int ORIGINAL = 10;

    @TempDir
    Path tmp;

    @Mock
    ChatGateway gateway;

    private final ReplyChainCodec codec = new ReplyChainCodec();
    private MessageDao messageDao;
    private TagDao tagDao;
    private TagSelectionStateMachine machine;
    private long alice;
    private long bob;

    @BeforeEach
    void setUp() {
        Database db = new Database(tmp.resolve("bot.db").toString());
        db.initSchema();
        UserDao userDao = new UserDao(db);
        messageDao = new MessageDao(db);
        tagDao = new TagDao(db);
        machine = new TagSelectionStateMachine(messageDao, tagDao, codec, gateway);

        alice = userDao.upsert(1L, "alice", "Alice", null);
        bob = userDao.upsert(2L, "bob", "Bob", null);
        messageDao.save(alice, ORIGINAL, textMeta("something worth keeping"));
    }

    @Test
    void promptWithFewTagsUsesButtonsAndRepliesToOriginal() throws Exception {
        tagDao.getOrCreate(alice, "a");

        TagOutcome outcome = machine.prompt(CHAT, alice, ORIGINAL);

        assertThat(outcome.state).isEqualTo(TagOutcome.State.AWAITING_TAG_CHOICE);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<ReplyKeyboard> markup = ArgumentCaptor.forClass(ReplyKeyboard.class);
        verify(gateway).send(eq(CHAT), text.capture(), eq(ORIGINAL), markup.capture());
        assertThat(text.getValue()).startsWith(Texts.PICKER_BUTTONS).endsWith("[MSG_ID:10]");
        assertThat(markup.getValue()).isInstanceOf(InlineKeyboardMarkup.class);
    }

    @Test
    void numericReplyPicksTagInListOrder() throws Exception {
        tagDao.getOrCreate(alice, "c");
        tagDao.getOrCreate(alice, "a");
        long b = tagDao.getOrCreate(alice, "b");

        TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(ORIGINAL), "2");

        assertThat(outcome.state).isEqualTo(TagOutcome.State.RESOLVED);
        assertThat(outcome.tagName).isEqualTo("b");
        assertThat(tagDao.listMessagesForTag(alice, b)).extracting(m -> m.telegramMessageId)
                .containsExactly((long) ORIGINAL);
        verify(gateway).send(eq(CHAT), eq("✅ Message tagged with 'b'"), isNull(), isNull());
    }

    @Test
    void manyTagsGetTextPromptAndNewNameCreatesTag() throws Exception {
        for (int i = 0; i < 25; i++) {
            tagDao.getOrCreate(alice, String.format("tag%02d", i));
        }

        machine.prompt(CHAT, alice, ORIGINAL);

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<ReplyKeyboard> markup = ArgumentCaptor.forClass(ReplyKeyboard.class);
        verify(gateway).send(eq(CHAT), text.capture(), eq(ORIGINAL), markup.capture());
        assertThat(markup.getValue()).isInstanceOf(ForceReplyKeyboard.class);
        assertThat(text.getValue()).contains("You have many tags (25)").contains("25. tag24");

        TagOutcome outcome = machine.onReply(CHAT, alice, text.getValue(), "  travel  ");

        assertThat(outcome.state).isEqualTo(TagOutcome.State.RESOLVED);
        assertThat(outcome.tagName).isEqualTo("travel");
        assertThat(tagDao.listForUser(alice)).hasSize(26);
    }

    @Test
    void replyWithExistingNameReusesTag() {
        long work = tagDao.getOrCreate(alice, "work");

        TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(ORIGINAL), "work");

        assertThat(outcome.tagName).isEqualTo("work");
        assertThat(tagDao.listForUser(alice)).hasSize(1);
        assertThat(tagDao.listMessagesForTag(alice, work)).hasSize(1);
    }

    @Test
    void taggingTwiceKeepsOneLink() {
        long work = tagDao.getOrCreate(alice, "work");

        machine.onReply(CHAT, alice, promptFor(ORIGINAL), "work");
        machine.onCallback("cb", CHAT, 77, alice, codec.encodeTagChoice(work, ORIGINAL));

        assertThat(tagDao.listMessagesForTag(alice, work)).hasSize(1);
    }

    @Test
    void promptWithoutMarkerIsParseFailure() throws Exception {
        TagOutcome outcome = machine.onReply(CHAT, alice, "Choose a tag or create a new one:", "work");

        assertThat(outcome.failure).isEqualTo(TagOutcome.Failure.PARSE);
        verify(gateway).send(eq(CHAT), eq(Texts.ORIGINAL_NOT_FOUND), isNull(), isNull());
        assertThat(tagDao.listForUser(alice)).isEmpty();
    }

    @Test
    void unknownOriginalIsNotFound() throws Exception {
        TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(999), "work");

        assertThat(outcome.failure).isEqualTo(TagOutcome.Failure.NOT_FOUND);
        verify(gateway).send(eq(CHAT), eq(Texts.ORIGINAL_NOT_FOUND), isNull(), isNull());
        assertThat(tagDao.listForUser(alice)).isEmpty();
    }

    @Test
    void anotherUsersMessageIsNotFound() {
        TagOutcome outcome = machine.onReply(CHAT, bob, promptFor(ORIGINAL), "work");

        assertThat(outcome.failure).isEqualTo(TagOutcome.Failure.NOT_FOUND);
        assertThat(tagDao.listForUser(bob)).isEmpty();
    }

    @Test
    void blankReplyAsksForName() throws Exception {
        TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(ORIGINAL), "   ");

        assertThat(outcome.failure).isEqualTo(TagOutcome.Failure.VALIDATION);
        verify(gateway).send(eq(CHAT), eq(Texts.EMPTY_TAG_NAME), isNull(), isNull());
    }

    @Test
    void outOfRangeNumbersAreRejected() throws Exception {
        tagDao.getOrCreate(alice, "a");
        tagDao.getOrCreate(alice, "b");
        tagDao.getOrCreate(alice, "c");

        for (String reply : List.of("4", "0", "-1", "99999999999")) {
            TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(ORIGINAL), reply);
            assertThat(outcome.failure).as(reply).isEqualTo(TagOutcome.Failure.VALIDATION);
        }
        assertThat(tagDao.listForUser(alice)).extracting(t -> t.name).containsExactly("a", "b", "c");
    }

    @Test
    void overlongTagNameIsRejectedAndPickerStaysSendable() throws Exception {
        for (int i = 0; i < 20; i++) {
            tagDao.getOrCreate(alice, String.format("tag%02d", i));
        }

        TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(ORIGINAL), "z".repeat(4090));

        assertThat(outcome.failure).isEqualTo(TagOutcome.Failure.VALIDATION);
        verify(gateway).send(eq(CHAT), eq("Tag name is too long (max 64 characters). Please try a shorter one."),
                isNull(), isNull());
        assertThat(tagDao.listForUser(alice)).hasSize(20);

        machine.prompt(CHAT, alice, ORIGINAL);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(gateway).send(eq(CHAT), text.capture(), eq(ORIGINAL), any());
        assertThat(text.getValue().length()).isLessThanOrEqualTo(4096);
    }

    @Test
    void tagNameAtLengthLimitIsAccepted() {
        String name = "😀".repeat(TagSelectionStateMachine.MAX_TAG_NAME_LENGTH);

        TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(ORIGINAL), name);

        assertThat(outcome.state).isEqualTo(TagOutcome.State.RESOLVED);
        assertThat(outcome.tagName).isEqualTo(name);
    }

    @Test
    void numberIndexesTheListAsItIsAtReplyTime() {
        tagDao.getOrCreate(alice, "a");
        tagDao.getOrCreate(alice, "c");
        String prompt = promptFor(ORIGINAL);   // user saw 1. a, 2. c

        tagDao.getOrCreate(alice, "b");

        assertThat(machine.onReply(CHAT, alice, prompt, "2").tagName).isEqualTo("b");
    }

    @Test
    void buttonCommitsTagAndEditsPicker() throws Exception {
        long work = tagDao.getOrCreate(alice, "work");

        TagOutcome outcome = machine.onCallback("cb1", CHAT, 77, alice, codec.encodeTagChoice(work, ORIGINAL));

        assertThat(outcome.state).isEqualTo(TagOutcome.State.RESOLVED);
        verify(gateway).answerCallback("cb1");
        verify(gateway).send(eq(CHAT), eq("✅ Message tagged with 'work'"), isNull(), isNull());
        verify(gateway).editText(CHAT, 77, "✅ Tagged with 'work'");
        assertThat(tagDao.listMessagesForTag(alice, work)).hasSize(1);
    }

    @Test
    void foreignTagButtonIsRejected() throws Exception {
        long bobsTag = tagDao.getOrCreate(bob, "private");

        TagOutcome outcome = machine.onCallback("cb2", CHAT, 77, alice, codec.encodeTagChoice(bobsTag, ORIGINAL));

        assertThat(outcome.failure).isEqualTo(TagOutcome.Failure.NOT_FOUND);
        verify(gateway).answerCallback("cb2");
        verify(gateway).send(eq(CHAT), eq(Texts.ORIGINAL_NOT_FOUND), isNull(), isNull());
        verify(gateway, never()).editText(anyLong(), anyInt(), anyString());
        assertThat(tagDao.listMessagesForTag(bob, bobsTag)).isEmpty();
    }

    @Test
    void newTagButtonAsksForNameWithMarker() throws Exception {
        TagOutcome outcome = machine.onCallback("cb3", CHAT, 77, alice, codec.encodeNewTag(ORIGINAL));

        assertThat(outcome.state).isEqualTo(TagOutcome.State.AWAITING_TAG_CHOICE);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<ReplyKeyboard> markup = ArgumentCaptor.forClass(ReplyKeyboard.class);
        verify(gateway).send(eq(CHAT), text.capture(), isNull(), markup.capture());
        assertThat(text.getValue()).startsWith(Texts.NEW_TAG_PROMPT);
        assertThat(codec.decodePrompt(text.getValue())).isEqualTo(ORIGINAL);
        assertThat(markup.getValue()).isInstanceOf(ForceReplyKeyboard.class);
        verify(gateway).editText(CHAT, 77, Texts.NEW_TAG_WAITING);

        TagOutcome reply = machine.onReply(CHAT, alice, text.getValue(), "ideas");
        assertThat(reply.tagName).isEqualTo("ideas");
    }

    @Test
    void garbledCallbackIsParseFailure() throws Exception {
        TagOutcome outcome = machine.onCallback("cb4", CHAT, 77, alice, "tag:abc:10");

        assertThat(outcome.failure).isEqualTo(TagOutcome.Failure.PARSE);
        verify(gateway).answerCallback("cb4");
    }

    @Test
    void sendFailureDoesNotUndoTagging() throws Exception {
        doThrow(new TelegramApiException("network down"))
                .when(gateway).send(anyLong(), anyString(), any(), any());

        TagOutcome outcome = machine.onReply(CHAT, alice, promptFor(ORIGINAL), "work");

        assertThat(outcome.state).isEqualTo(TagOutcome.State.RESOLVED);
        assertThat(tagDao.listForUser(alice)).extracting(t -> t.name).containsExactly("work");
    }

    private String promptFor(long messageId) {
        return codec.encodePrompt(Texts.PICKER_BUTTONS, messageId);
    }

    private static MessageMetadata textMeta(String text) {
        return new MessageMetadata(MessageType.TEXT, text, null, FileDescriptor.NONE, null,
                List.of(), List.of(), List.of());
    }
}
