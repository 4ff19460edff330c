package com.contentorganizer.bot.db;

import com.contentorganizer.bot.model.User;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

public final class UserDao {
    private final Database db;

    public UserDao(Database db) {
        this.db = db;
    }

    /**
     * Inserts or refreshes the user and returns the internal users.id.
     */
    public long upsert(long telegramId, String username, String firstName, String lastName) {
        long now = Instant.now().toEpochMilli();
        try (Connection conn = db.openConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO users (telegram_id, username, first_name, last_name, is_active, created_at, updated_at)
                    VALUES (?, ?, ?, ?, 1, ?, ?)
                    ON CONFLICT(telegram_id) DO UPDATE SET
                        username = excluded.username,
                        first_name = excluded.first_name,
                        last_name = excluded.last_name,
                        is_active = 1,
                        updated_at = excluded.updated_at
                    """)) {
                ps.setLong(1, telegramId);
                ps.setString(2, emptyToNull(username));
                ps.setString(3, emptyToNull(firstName));
                ps.setString(4, emptyToNull(lastName));
                ps.setLong(5, now);
                ps.setLong(6, now);
                ps.executeUpdate();
            }
            return findId(conn, telegramId)
                    .orElseThrow(() -> new StoreException("upsert did not produce a row for telegramId=" + telegramId));
        } catch (SQLException e) {
            throw new StoreException("upsertUser failed", e);
        }
    }

    public Optional<Long> findIdByTelegramId(long telegramId) {
        try (Connection conn = db.openConnection()) {
            return findId(conn, telegramId);
        } catch (SQLException e) {
            throw new StoreException("findIdByTelegramId failed", e);
        }
    }

    public Optional<User> getUser(long telegramId) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT id, telegram_id, username, first_name, last_name, is_active
                     FROM users WHERE telegram_id = ?
                     """)) {
            ps.setLong(1, telegramId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new User(
                        rs.getLong("id"),
                        rs.getLong("telegram_id"),
                        rs.getString("username"),
                        rs.getString("first_name"),
                        rs.getString("last_name"),
                        rs.getInt("is_active") == 1
                ));
            }
        } catch (SQLException e) {
            throw new StoreException("getUser failed", e);
        }
    }

    private static Optional<Long> findId(Connection conn, long telegramId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM users WHERE telegram_id = ?")) {
            ps.setLong(1, telegramId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(rs.getLong("id"));
            }
        }
    }

    private static String emptyToNull(String s) {
        return (s == null || s.isEmpty()) ? null : s;
    }
}
