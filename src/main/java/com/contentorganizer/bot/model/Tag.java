package com.contentorganizer.bot.model;

public final class Tag {
    public final long id;
    public final long userId;
    public final String name;
    public final String color; // nullable

    public Tag(long id, long userId, String name, String color) {
        this.id = id;
        this.userId = userId;
        this.name = name;
        this.color = color;
    }
}
