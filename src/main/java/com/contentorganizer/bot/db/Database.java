package com.contentorganizer.bot.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Store handle: built once at start-up and passed to every DAO.
 * Each DAO call opens its own short-lived connection.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final String jdbcUrl;

    public Database(String dbPath) {
        this.jdbcUrl = "jdbc:sqlite:" + dbPath;
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys = ON;");
            st.execute("PRAGMA journal_mode = WAL;");
            st.execute("PRAGMA synchronous = NORMAL;");
            st.execute("PRAGMA busy_timeout = 5000;");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {

            st.execute("""
                    CREATE TABLE IF NOT EXISTS users (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        telegram_id INTEGER NOT NULL UNIQUE,
                        username TEXT,
                        first_name TEXT,
                        last_name TEXT,
                        is_active INTEGER NOT NULL DEFAULT 1,
                        created_at INTEGER NOT NULL,
                        updated_at INTEGER NOT NULL
                    );
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        user_id INTEGER NOT NULL,
                        telegram_message_id INTEGER NOT NULL,
                        message_type TEXT NOT NULL,
                        text_content TEXT,
                        caption TEXT,
                        file_id TEXT,
                        file_name TEXT,
                        file_size INTEGER,
                        mime_type TEXT,
                        duration INTEGER,
                        forwarded_date INTEGER,
                        forwarded_from TEXT,
                        urls TEXT NOT NULL DEFAULT '[]',
                        hashtags TEXT NOT NULL DEFAULT '[]',
                        mentions TEXT NOT NULL DEFAULT '[]',
                        created_at INTEGER NOT NULL,
                        UNIQUE(user_id, telegram_message_id),
                        FOREIGN KEY (user_id) REFERENCES users(id) ON DELETE CASCADE
                    );
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS tags (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        user_id INTEGER NOT NULL,
                        name TEXT NOT NULL,
                        color TEXT,
                        created_at INTEGER NOT NULL,
                        UNIQUE(user_id, name),
                        FOREIGN KEY (user_id) REFERENCES users(id) ON DELETE CASCADE
                    );
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS message_tags (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        message_id INTEGER NOT NULL,
                        tag_id INTEGER NOT NULL,
                        created_at INTEGER NOT NULL,
                        UNIQUE(message_id, tag_id),
                        FOREIGN KEY (message_id) REFERENCES messages(id) ON DELETE CASCADE,
                        FOREIGN KEY (tag_id) REFERENCES tags(id) ON DELETE CASCADE
                    );
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_message_tags_tag ON message_tags(tag_id);");

            log.info("SQLite schema initialized.");
        } catch (SQLException e) {
            throw new StoreException("Failed to init SQLite schema", e);
        }
    }
}
