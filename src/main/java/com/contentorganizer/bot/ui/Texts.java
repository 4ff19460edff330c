package com.contentorganizer.bot.ui;

public final class Texts {
    private Texts() {}

    public static final String START =
            "Hello! I'm your Telegram Content Organizer bot. Send me any message or forward content to me!";

    public static final String HELP = """
            Available commands:
            /start - Get started
            /help - Show this help message
            /miniapp - Open mini-app to view your tags

            You can also send me any message or forward content to me.""";

    public static final String UNKNOWN_COMMAND = "Unknown command. Use /help to see available commands.";

    public static final String MINIAPP_PROMPT = "Open the mini-app to view and manage your tags:";
    public static final String MINIAPP_BUTTON = "🏷️ View My Tags";
    public static final String MINIAPP_NOT_CONFIGURED = "The mini-app is not available right now.";

    // tag picker
    public static final String PICKER_NO_TAGS =
            "You don't have any tags yet. Click the button below to create your first tag:";
    public static final String PICKER_BUTTONS = "Choose a tag or create a new one:";
    public static final String PICKER_TEXT_HEADER =
            "You have many tags (%d). Choose by typing its name or number, or create a new one:";
    public static final String PICKER_TEXT_FOOTER = "Type a tag name/number or create a new tag.";
    public static final String PICKER_TEXT_MORE = "...and %d more (type the name or number)";
    public static final String CREATE_TAG_BUTTON = "➕ Create New Tag";

    public static final String NEW_TAG_PROMPT = "Please reply with the name for your new tag:";
    public static final String NEW_TAG_WAITING = "Please reply with your new tag name...";

    public static final String TAGGED_CONFIRMATION = "✅ Message tagged with '%s'";
    public static final String TAGGED_PICKER = "✅ Tagged with '%s'";

    // failures
    public static final String SAVE_FAILED = "Sorry, I couldn't save your message. Please try again.";
    public static final String ALREADY_SAVED = "I already have this message saved.";
    public static final String TAGS_LOAD_FAILED = "Could not load your tags.";
    public static final String ORIGINAL_NOT_FOUND = "Could not find the original message to tag.";
    public static final String EMPTY_TAG_NAME = "Please enter a tag name.";
    public static final String TAG_NAME_TOO_LONG = "Tag name is too long (max %d characters). Please try a shorter one.";
    public static final String INVALID_TAG_NUMBER = "Invalid tag number. Please try again.";
    public static final String TAG_SAVE_FAILED = "Could not tag the message. Please try again.";
    public static final String GENERIC_FAILURE = "Something went wrong. Please try again.";
}
