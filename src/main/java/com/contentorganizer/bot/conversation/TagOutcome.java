package com.contentorganizer.bot.conversation;

/**
 * Where one conversation step left the tagging exchange.
 */
public final class TagOutcome {
    public enum State {
        AWAITING_TAG_CHOICE,
        RESOLVED,
        FAILED
    }

    public enum Failure {
        /** Marker or callback data unreadable. */
        PARSE,
        /** Message or tag unknown for this user. */
        NOT_FOUND,
        /** Empty tag name or index out of range. */
        VALIDATION,
        STORE
    }

    private static final TagOutcome AWAITING = new TagOutcome(State.AWAITING_TAG_CHOICE, null, null);

    public final State state;
    public final Failure failure;   // set when FAILED
    public final String tagName;    // set when RESOLVED

    private TagOutcome(State state, Failure failure, String tagName) {
        this.state = state;
        this.failure = failure;
        this.tagName = tagName;
    }

    public static TagOutcome awaiting() {
        return AWAITING;
    }

    public static TagOutcome resolved(String tagName) {
        return new TagOutcome(State.RESOLVED, null, tagName);
    }

    public static TagOutcome failed(Failure failure) {
        return new TagOutcome(State.FAILED, failure, null);
    }

    @Override
    public String toString() {
        return switch (state) {
            case AWAITING_TAG_CHOICE -> "AWAITING_TAG_CHOICE";
            case RESOLVED -> "RESOLVED('" + tagName + "')";
            case FAILED -> "FAILED(" + failure + ")";
        };
    }
}
