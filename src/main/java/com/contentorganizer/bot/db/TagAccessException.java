package com.contentorganizer.bot.db;

/**
 * Tag does not exist or belongs to another user. The two cases are not told apart.
 */
public class TagAccessException extends StoreException {

    public TagAccessException(long tagId) {
        super("Tag not found or access denied: " + tagId);
    }
}
