package com.contentorganizer.bot.db;

/** A message with the same (user, telegram message id) is already stored. */
public class DuplicateMessageException extends StoreException {

    public DuplicateMessageException(long userId, long telegramMessageId) {
        super("Message already stored: user=" + userId + ", telegramMessageId=" + telegramMessageId);
    }
}
