package com.contentorganizer.bot.model;

import java.time.Instant;
import java.util.List;

/** Read-side view of a stored message, as listed under a tag. */
public final class MessageSummary {
    public final long id;
    public final long telegramMessageId;
    public final MessageType type;
    public final String textContent;
    public final String caption;
    public final String fileName;
    public final Long fileSize;
    public final Instant createdAt;
    public final String forwardedFrom;
    public final List<String> urls;
    public final List<String> hashtags;

    public MessageSummary(long id,
                          long telegramMessageId,
                          MessageType type,
                          String textContent,
                          String caption,
                          String fileName,
                          Long fileSize,
                          Instant createdAt,
                          String forwardedFrom,
                          List<String> urls,
                          List<String> hashtags) {
        this.id = id;
        this.telegramMessageId = telegramMessageId;
        this.type = type;
        this.textContent = textContent;
        this.caption = caption;
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.createdAt = createdAt;
        this.forwardedFrom = forwardedFrom;
        this.urls = urls == null ? List.of() : List.copyOf(urls);
        this.hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }
}
