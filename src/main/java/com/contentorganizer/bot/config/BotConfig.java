package com.contentorganizer.bot.config;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

public final class BotConfig {
    public final String botToken;
    public final String botUsername;

    public final String dbPath;

    // nullable: /miniapp says the mini-app is unavailable
    public final String miniAppUrl;

    public final String logLevel;

    private BotConfig(
            String botToken,
            String botUsername,
            String dbPath,
            String miniAppUrl,
            String logLevel
    ) {
        this.botToken = botToken;
        this.botUsername = botUsername;
        this.dbPath = dbPath;
        this.miniAppUrl = miniAppUrl;
        this.logLevel = logLevel;
    }

    public static BotConfig fromEnv() {
        return from(System::getenv);
    }

    public static BotConfig from(Function<String, String> lookup) {
        String token = required(lookup, "BOT_TOKEN");
        String username = required(lookup, "BOT_USERNAME");

        String dbPath = env(lookup, "DB_PATH").orElse("/data/organizer.db");
        String miniAppUrl = env(lookup, "MINIAPP_URL").orElse(null);

        String logLevel = env(lookup, "LOG_LEVEL").orElse("INFO").toUpperCase(Locale.ROOT);

        return new BotConfig(token, username, dbPath, miniAppUrl, logLevel);
    }

    private static Optional<String> env(Function<String, String> lookup, String name) {
        return Optional.ofNullable(lookup.apply(name)).map(String::trim).filter(s -> !s.isEmpty());
    }

    private static String required(Function<String, String> lookup, String name) {
        return env(lookup, name).orElseThrow(() -> new IllegalStateException("Missing required ENV variable: " + name));
    }
}
