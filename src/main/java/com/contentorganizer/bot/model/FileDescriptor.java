package com.contentorganizer.bot.model;

/**
 * File attached to a media message. Every field is nullable: absent means
 * Telegram did not supply it.
 */
public final class FileDescriptor {
    public static final FileDescriptor NONE = new FileDescriptor(null, null, null, null, null);

    public final String fileId;
    public final String fileName;
    public final String mimeType;
    public final Long fileSize;
    public final Integer duration;

    public FileDescriptor(String fileId, String fileName, String mimeType, Long fileSize, Integer duration) {
        this.fileId = fileId;
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.fileSize = fileSize;
        this.duration = duration;
    }
}
