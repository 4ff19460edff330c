package com.contentorganizer.bot.db;

import com.contentorganizer.bot.model.FileDescriptor;
import com.contentorganizer.bot.model.MessageMetadata;
import com.contentorganizer.bot.model.Provenance;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;

public final class MessageDao {
    public static final int PREVIEW_LENGTH = 150;
    public static final String TRUNCATION_MARKER = "...";

    private final Database db;

    public MessageDao(Database db) {
        this.db = db;
    }

    /**
     * Stores one inbound message and returns its row id.
     *
     * @throws DuplicateMessageException if (userId, telegramMessageId) is already stored
     */
    public long save(long userId, long telegramMessageId, MessageMetadata meta) {
        long now = Instant.now().toEpochMilli();
        FileDescriptor file = meta.file;
        Provenance prov = meta.provenance;

        try (Connection conn = db.openConnection()) {
            int inserted;
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO messages (
                        user_id, telegram_message_id, message_type, text_content, caption,
                        file_id, file_name, file_size, mime_type, duration,
                        forwarded_date, forwarded_from, urls, hashtags, mentions, created_at
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    ON CONFLICT(user_id, telegram_message_id) DO NOTHING
                    """)) {
                ps.setLong(1, userId);
                ps.setLong(2, telegramMessageId);
                ps.setString(3, meta.type.dbValue());
                ps.setString(4, preview(meta.text));
                ps.setString(5, preview(meta.caption));
                ps.setString(6, file.fileId);
                ps.setString(7, file.fileName);
                setNullableLong(ps, 8, file.fileSize);
                ps.setString(9, file.mimeType);
                setNullableLong(ps, 10, file.duration == null ? null : file.duration.longValue());
                setNullableLong(ps, 11, prov == null || prov.forwardedDate == null ? null : prov.forwardedDate.toEpochMilli());
                ps.setString(12, prov == null ? null : prov.forwardedFrom);
                ps.setString(13, StringArrays.encode(meta.urls));
                ps.setString(14, StringArrays.encode(meta.hashtags));
                ps.setString(15, StringArrays.encode(meta.mentions));
                ps.setLong(16, now);
                inserted = ps.executeUpdate();
            }
            if (inserted == 0) {
                throw new DuplicateMessageException(userId, telegramMessageId);
            }
            return findId(conn, userId, telegramMessageId)
                    .orElseThrow(() -> new StoreException("saveMessage did not produce a row"));
        } catch (SQLException e) {
            throw new StoreException("saveMessage failed", e);
        }
    }

    /**
     * Translates a Telegram message id back to the stored row, scoped to the user.
     */
    public Optional<Long> resolveId(long userId, long telegramMessageId) {
        try (Connection conn = db.openConnection()) {
            return findId(conn, userId, telegramMessageId);
        } catch (SQLException e) {
            throw new StoreException("resolveMessageId failed", e);
        }
    }

    /**
     * Cuts text to {@link #PREVIEW_LENGTH} code points and appends the marker.
     */
    public static String preview(String text) {
        if (text == null || text.isEmpty()) return null;
        if (text.codePointCount(0, text.length()) <= PREVIEW_LENGTH) return text;
        int end = text.offsetByCodePoints(0, PREVIEW_LENGTH);
        return text.substring(0, end) + TRUNCATION_MARKER;
    }

    private static Optional<Long> findId(Connection conn, long userId, long telegramMessageId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                SELECT id FROM messages WHERE user_id = ? AND telegram_message_id = ?
                """)) {
            ps.setLong(1, userId);
            ps.setLong(2, telegramMessageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(rs.getLong("id"));
            }
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) ps.setNull(index, Types.INTEGER);
        else ps.setLong(index, value);
    }
}
