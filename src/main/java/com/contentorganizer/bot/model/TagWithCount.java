package com.contentorganizer.bot.model;

import java.time.Instant;

public final class TagWithCount {
    public final Tag tag;
    public final Instant createdAt;
    public final int messageCount;

    public TagWithCount(Tag tag, Instant createdAt, int messageCount) {
        this.tag = tag;
        this.createdAt = createdAt;
        this.messageCount = messageCount;
    }
}
