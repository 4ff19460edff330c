package com.contentorganizer.bot.ui;

import com.contentorganizer.bot.conversation.ConversationCodec;
import com.contentorganizer.bot.conversation.UiMode;
import com.contentorganizer.bot.conversation.UiModeSelector;
import com.contentorganizer.bot.model.Tag;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the prompt offered right after a message is saved. Tags must come
 * in the order {@code TagDao.listForUser} returns them.
 */
public final class TagPickerRenderer {
    private static final int BUTTONS_PER_ROW = 2;

    /** Telegram's message text limit. */
    static final int MAX_MESSAGE_LENGTH = 4096;
    // room for the "...and N more" line and the marker the codec appends
    private static final int TAIL_RESERVE = 96;

    private final ConversationCodec codec;

    public TagPickerRenderer(ConversationCodec codec) {
        this.codec = codec;
    }

    public TagPicker render(List<Tag> tags, long messageId) {
        UiMode mode = UiModeSelector.chooseMode(tags.size());
        return switch (mode) {
            case BUTTONS -> withButtons(tags, messageId);
            case TEXT -> withText(tags, messageId);
        };
    }

    public TagPicker newTagPrompt(long messageId) {
        return new TagPicker(UiMode.TEXT, codec.encodePrompt(Texts.NEW_TAG_PROMPT, messageId), Keyboards.forceReply());
    }

    private TagPicker withButtons(List<Tag> tags, long messageId) {
        List<InlineKeyboardButton> buttons = new ArrayList<>();
        for (Tag tag : tags) {
            buttons.add(Keyboards.callbackButton(tag.name, codec.encodeTagChoice(tag.id, messageId)));
        }
        InlineKeyboardButton create = Keyboards.callbackButton(Texts.CREATE_TAG_BUTTON, codec.encodeNewTag(messageId));

        String text = tags.isEmpty() ? Texts.PICKER_NO_TAGS : Texts.PICKER_BUTTONS;
        return new TagPicker(UiMode.BUTTONS, codec.encodePrompt(text, messageId),
                Keyboards.grid(buttons, BUTTONS_PER_ROW, create));
    }

    private TagPicker withText(List<Tag> tags, long messageId) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Texts.PICKER_TEXT_HEADER, tags.size())).append("\n\n");
        int budget = MAX_MESSAGE_LENGTH - TAIL_RESERVE - Texts.PICKER_TEXT_FOOTER.length();
        for (int i = 0; i < tags.size(); i++) {
            String line = (i + 1) + ". " + tags.get(i).name + "\n";
            if (sb.length() + line.length() > budget) {
                // numbers past the cut still resolve against the full list
                sb.append(String.format(Texts.PICKER_TEXT_MORE, tags.size() - i)).append('\n');
                break;
            }
            sb.append(line);
        }
        sb.append('\n').append(Texts.PICKER_TEXT_FOOTER);
        return new TagPicker(UiMode.TEXT, codec.encodePrompt(sb.toString(), messageId), Keyboards.forceReply());
    }
}
