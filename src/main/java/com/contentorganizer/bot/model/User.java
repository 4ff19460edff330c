package com.contentorganizer.bot.model;

public final class User {
    public final long id;
    public final long telegramId;
    public final String username;
    public final String firstName;
    public final String lastName;
    public final boolean active;

    public User(long id, long telegramId, String username, String firstName, String lastName, boolean active) {
        this.id = id;
        this.telegramId = telegramId;
        this.username = username;
        this.firstName = firstName;
        this.lastName = lastName;
        this.active = active;
    }
}
