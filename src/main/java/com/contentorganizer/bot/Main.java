package com.contentorganizer.bot;

import com.contentorganizer.bot.config.BotConfig;
import com.contentorganizer.bot.db.Database;
import com.contentorganizer.bot.db.MessageDao;
import com.contentorganizer.bot.db.TagDao;
import com.contentorganizer.bot.db.UserDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.Locale;

public final class Main {

    public static void main(String[] args) throws Exception {
        BotConfig config = BotConfig.fromEnv();

        // must run before the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", config.logLevel.toLowerCase(Locale.ROOT));
        Logger log = LoggerFactory.getLogger(Main.class);

        Database db = new Database(config.dbPath);
        db.initSchema();

        UserDao userDao = new UserDao(db);
        MessageDao messageDao = new MessageDao(db);
        TagDao tagDao = new TagDao(db);

        ContentOrganizerBot bot = new ContentOrganizerBot(config, userDao, messageDao, tagDao);

        TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
        BotSession session = botsApi.registerBot(bot);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown...");
            if (session.isRunning()) session.stop();
        }));

        log.info("Bot started as @{}", config.botUsername);
    }
}
