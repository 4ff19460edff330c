package com.contentorganizer.bot.db;

import com.contentorganizer.bot.model.MessageSummary;
import com.contentorganizer.bot.model.MessageType;
import com.contentorganizer.bot.model.Tag;
import com.contentorganizer.bot.model.TagWithCount;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class TagDao {
    private final Database db;

    public TagDao(Database db) {
        this.db = db;
    }

    /**
     * User's tags by name ascending. Numbered prompts index into this order.
     */
    public List<Tag> listForUser(long userId) {
        List<Tag> tags = new ArrayList<>();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT id, user_id, name, color
                     FROM tags
                     WHERE user_id = ?
                     ORDER BY name ASC, id ASC
                     """)) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tags.add(readTag(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("listTags failed", e);
        }
        return tags;
    }

    /**
     * Returns the id of the user's tag with this name, creating it if needed.
     * A concurrent insert of the same name is absorbed by the unique index.
     */
    public long getOrCreate(long userId, String name) {
        long now = Instant.now().toEpochMilli();
        try (Connection conn = db.openConnection()) {
            Optional<Long> existing = findIdByName(conn, userId, name);
            if (existing.isPresent()) return existing.get();

            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO tags (user_id, name, created_at)
                    VALUES (?, ?, ?)
                    ON CONFLICT(user_id, name) DO NOTHING
                    """)) {
                ps.setLong(1, userId);
                ps.setString(2, name);
                ps.setLong(3, now);
                ps.executeUpdate();
            }

            return findIdByName(conn, userId, name)
                    .orElseThrow(() -> new StoreException("getOrCreateTag lost tag '" + name + "' for user " + userId));
        } catch (SQLException e) {
            throw new StoreException("getOrCreateTag failed", e);
        }
    }

    /**
     * Tag name only if the tag belongs to this user.
     */
    public Optional<String> findName(long tagId, long userId) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT name FROM tags WHERE id = ? AND user_id = ?
                     """)) {
            ps.setLong(1, tagId);
            ps.setLong(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(rs.getString("name"));
            }
        } catch (SQLException e) {
            throw new StoreException("findTagName failed", e);
        }
    }

    /** Idempotent: linking an already linked pair is a no-op. */
    public void link(long messageId, long tagId) {
        long now = Instant.now().toEpochMilli();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO message_tags (message_id, tag_id, created_at)
                     VALUES (?, ?, ?)
                     ON CONFLICT(message_id, tag_id) DO NOTHING
                     """)) {
            ps.setLong(1, messageId);
            ps.setLong(2, tagId);
            ps.setLong(3, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("linkTag failed", e);
        }
    }

    public List<TagWithCount> listWithCounts(long userId) {
        List<TagWithCount> out = new ArrayList<>();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT t.id, t.user_id, t.name, t.color, t.created_at, COUNT(mt.message_id) AS message_count
                     FROM tags t
                     LEFT JOIN message_tags mt ON t.id = mt.tag_id
                     WHERE t.user_id = ?
                     GROUP BY t.id, t.user_id, t.name, t.color, t.created_at
                     ORDER BY message_count DESC, t.name ASC
                     """)) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TagWithCount(
                            readTag(rs),
                            Instant.ofEpochMilli(rs.getLong("created_at")),
                            rs.getInt("message_count")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("listTagsWithCounts failed", e);
        }
        return out;
    }

    /**
     * Messages under a tag, newest first.
     *
     * @throws TagAccessException if the tag is missing or owned by another user
     */
    public List<MessageSummary> listMessagesForTag(long userId, long tagId) {
        List<MessageSummary> out = new ArrayList<>();
        try (Connection conn = db.openConnection()) {
            if (!tagBelongsTo(conn, tagId, userId)) {
                throw new TagAccessException(tagId);
            }

            try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT m.id, m.telegram_message_id, m.message_type, m.text_content, m.caption,
                           m.file_name, m.file_size, m.created_at, m.forwarded_from, m.urls, m.hashtags
                    FROM messages m
                    INNER JOIN message_tags mt ON m.id = mt.message_id
                    WHERE mt.tag_id = ? AND m.user_id = ?
                    ORDER BY m.created_at DESC, m.id DESC
                    """)) {
                ps.setLong(1, tagId);
                ps.setLong(2, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new MessageSummary(
                                rs.getLong("id"),
                                rs.getLong("telegram_message_id"),
                                MessageType.fromDbValue(rs.getString("message_type")),
                                rs.getString("text_content"),
                                rs.getString("caption"),
                                rs.getString("file_name"),
                                nullableLong(rs, "file_size"),
                                Instant.ofEpochMilli(rs.getLong("created_at")),
                                rs.getString("forwarded_from"),
                                StringArrays.decode(rs.getString("urls")),
                                StringArrays.decode(rs.getString("hashtags"))
                        ));
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreException("listMessagesForTag failed", e);
        }
        return out;
    }

    private static boolean tagBelongsTo(Connection conn, long tagId, long userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                SELECT 1 FROM tags WHERE id = ? AND user_id = ?
                """)) {
            ps.setLong(1, tagId);
            ps.setLong(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static Optional<Long> findIdByName(Connection conn, long userId, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                SELECT id FROM tags WHERE user_id = ? AND name = ?
                """)) {
            ps.setLong(1, userId);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(rs.getLong("id"));
            }
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static Tag readTag(ResultSet rs) throws SQLException {
        return new Tag(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getString("name"),
                rs.getString("color")
        );
    }
}
