package com.contentorganizer.bot.extract;

import com.contentorganizer.bot.model.FileDescriptor;
import com.contentorganizer.bot.model.MessageMetadata;
import com.contentorganizer.bot.model.MessageType;
import com.contentorganizer.bot.model.Provenance;
import org.telegram.telegrambots.meta.api.objects.Audio;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.Video;
import org.telegram.telegrambots.meta.api.objects.VideoNote;
import org.telegram.telegrambots.meta.api.objects.Voice;
import org.telegram.telegrambots.meta.api.objects.stickers.Sticker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure functions over an inbound Telegram message. No I/O.
 *
 * <p>Hashtags and mentions are matched anywhere, so a URL fragment
 * ({@code page#top}) yields a hashtag and an e-mail address yields a mention
 * of its domain label. Both are kept as-is.
 */
public final class MetadataExtractor {
    private MetadataExtractor() {}

    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern HASHTAG = Pattern.compile("#\\w+");
    private static final Pattern MENTION = Pattern.compile("@\\w+");

    public static MessageMetadata extract(Message message) {
        MessageType type = classify(message);
        String text = message.getText();
        String caption = message.getCaption();
        return new MessageMetadata(
                type,
                text,
                caption,
                fileMetadata(message, type),
                provenance(message),
                extractUrls(text, caption),
                extractHashtags(text, caption),
                extractMentions(text, caption)
        );
    }

    public static MessageType classify(Message message) {
        if (message.getPhoto() != null && !message.getPhoto().isEmpty()) return MessageType.PHOTO;
        if (message.getVideo() != null) return MessageType.VIDEO;
        if (message.getDocument() != null) return MessageType.DOCUMENT;
        if (message.getAudio() != null) return MessageType.AUDIO;
        if (message.getVoice() != null) return MessageType.VOICE;
        if (message.getVideoNote() != null) return MessageType.VIDEO_NOTE;
        if (message.getSticker() != null) return MessageType.STICKER;
        return MessageType.TEXT;
    }

    public static List<String> extractUrls(String text, String caption) {
        return scan(URL, text, caption, 0);
    }

    public static List<String> extractHashtags(String text, String caption) {
        return scan(HASHTAG, text, caption, 1);
    }

    public static List<String> extractMentions(String text, String caption) {
        return scan(MENTION, text, caption, 1);
    }

    public static FileDescriptor fileMetadata(Message message, MessageType type) {
        switch (type) {
            case PHOTO -> {
                // first size is the smallest one
                PhotoSize p = message.getPhoto().get(0);
                return new FileDescriptor(blankToNull(p.getFileId()), null, null, positive(p.getFileSize()), null);
            }
            case VIDEO -> {
                Video v = message.getVideo();
                return new FileDescriptor(blankToNull(v.getFileId()), blankToNull(v.getFileName()),
                        blankToNull(v.getMimeType()), positive(v.getFileSize()), seconds(v.getDuration()));
            }
            case DOCUMENT -> {
                Document d = message.getDocument();
                return new FileDescriptor(blankToNull(d.getFileId()), blankToNull(d.getFileName()),
                        blankToNull(d.getMimeType()), positive(d.getFileSize()), null);
            }
            case AUDIO -> {
                Audio a = message.getAudio();
                return new FileDescriptor(blankToNull(a.getFileId()), blankToNull(a.getFileName()),
                        blankToNull(a.getMimeType()), positive(a.getFileSize()), seconds(a.getDuration()));
            }
            case VOICE -> {
                Voice v = message.getVoice();
                return new FileDescriptor(blankToNull(v.getFileId()), null,
                        blankToNull(v.getMimeType()), positive(v.getFileSize()), seconds(v.getDuration()));
            }
            case VIDEO_NOTE -> {
                VideoNote vn = message.getVideoNote();
                return new FileDescriptor(blankToNull(vn.getFileId()), null, null,
                        positive(vn.getFileSize()), seconds(vn.getDuration()));
            }
            case STICKER -> {
                Sticker s = message.getSticker();
                return new FileDescriptor(blankToNull(s.getFileId()), null, null, positive(s.getFileSize()), null);
            }
            default -> {
                return FileDescriptor.NONE;
            }
        }
    }

    /**
     * Forwarding origin, or null when the message was not forwarded.
     * Sender user first, then the source chat, then the hidden sender name.
     */
    public static Provenance provenance(Message message) {
        String from = null;

        User u = message.getForwardFrom();
        Chat chat = message.getForwardFromChat();
        if (u != null) {
            StringBuilder sb = new StringBuilder(nullToEmpty(u.getFirstName()));
            if (!isBlank(u.getLastName())) sb.append(' ').append(u.getLastName());
            if (!isBlank(u.getUserName())) sb.append(" (@").append(u.getUserName()).append(')');
            from = sb.toString().trim();
        } else if (chat != null) {
            StringBuilder sb = new StringBuilder(nullToEmpty(chat.getTitle()));
            if (!isBlank(chat.getUserName())) sb.append(" (@").append(chat.getUserName()).append(')');
            from = sb.toString().trim();
        } else if (!isBlank(message.getForwardSenderName())) {
            from = message.getForwardSenderName().trim();
        }

        Integer date = message.getForwardDate();
        Instant forwardedDate = (date != null && date > 0) ? Instant.ofEpochSecond(date) : null;

        if (forwardedDate == null && isBlank(from)) return null;
        return new Provenance(forwardedDate, isBlank(from) ? null : from);
    }

    /* ---------------------------
       Helpers
       --------------------------- */

    private static List<String> scan(Pattern pattern, String text, String caption, int stripPrefix) {
        List<String> out = new ArrayList<>();
        collect(pattern, text, stripPrefix, out);
        collect(pattern, caption, stripPrefix, out);
        return out;
    }

    private static void collect(Pattern pattern, String source, int stripPrefix, List<String> out) {
        if (source == null || source.isEmpty()) return;
        Matcher m = pattern.matcher(source);
        while (m.find()) {
            out.add(m.group().substring(stripPrefix));
        }
    }

    // Bot API sizes are Integer for some media and Long for others
    private static Long positive(Number n) {
        if (n == null || n.longValue() <= 0) return null;
        return n.longValue();
    }

    private static Integer seconds(Number n) {
        if (n == null || n.intValue() <= 0) return null;
        return n.intValue();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
