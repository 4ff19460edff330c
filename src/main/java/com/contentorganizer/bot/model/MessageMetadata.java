package com.contentorganizer.bot.model;

import java.util.List;

/**
 * Everything derived from an inbound message before it is stored.
 * Text and caption are the full values; the store keeps previews only.
 */
public final class MessageMetadata {
    public final MessageType type;
    public final String text;
    public final String caption;
    public final FileDescriptor file;
    public final Provenance provenance; // null when not forwarded
    public final List<String> urls;
    public final List<String> hashtags;
    public final List<String> mentions;

    public MessageMetadata(MessageType type,
                           String text,
                           String caption,
                           FileDescriptor file,
                           Provenance provenance,
                           List<String> urls,
                           List<String> hashtags,
                           List<String> mentions) {
        this.type = type;
        this.text = text;
        this.caption = caption;
        this.file = file == null ? FileDescriptor.NONE : file;
        this.provenance = provenance;
        this.urls = List.copyOf(urls);
        this.hashtags = List.copyOf(hashtags);
        this.mentions = List.copyOf(mentions);
    }
}
