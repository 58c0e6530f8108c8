package com.giftsbuyer.cli.bootstrap;

import ch.qos.logback.classic.Level;
import com.giftsbuyer.application.config.AcquisitionSettings;
import com.giftsbuyer.application.config.ChannelIds;
import com.giftsbuyer.application.config.ConfigKey;
import com.giftsbuyer.application.engine.GiftMonitor;
import com.giftsbuyer.application.lifecycle.BotStateManager;
import com.giftsbuyer.application.notification.AcquisitionReporter;
import com.giftsbuyer.application.notification.Messages;
import com.giftsbuyer.application.ports.ConfigPort;
import com.giftsbuyer.application.ports.GiftPlatformPort;
import com.giftsbuyer.application.ports.NewGiftListener;
import com.giftsbuyer.application.ports.NotifierPort;
import com.giftsbuyer.application.ports.SnapshotStorePort;
import com.giftsbuyer.application.purchase.PurchaseOrchestrator;
import com.giftsbuyer.application.purchase.PurchaseThrottle;
import com.giftsbuyer.domain.purchase.PurchaseErrorClassifier;
import com.giftsbuyer.infrastructure.notification.ConsoleNotifier;
import com.giftsbuyer.infrastructure.notification.TelegramNotifier;
import com.giftsbuyer.infrastructure.snapshot.JsonFileSnapshotStore;
import com.giftsbuyer.infrastructure.telegram.TelegramBotApiClient;
import com.giftsbuyer.infrastructure.telegram.TelegramGiftPlatformAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class Bootstrap {

    private static final Logger log = LoggerFactory.getLogger(Bootstrap.class);

    public static final String DEFAULT_SNAPSHOT_FILE = "data/history.json";

    private Bootstrap() {
    }

    /** Wires up a GiftMonitor against the real Telegram Bot API. */
    public static GiftMonitor createMonitor(ConfigPort config) {
        applyLogLevel(config.get(ConfigKey.LOG_LEVEL.key(), "INFO"));

        TelegramBotApiClient api = new TelegramBotApiClient(
                config.get(ConfigKey.TELEGRAM_API_URL.key(), TelegramBotApiClient.DEFAULT_BASE_URL),
                config.getSecret(ConfigKey.TELEGRAM_BOT_TOKEN.key()));

        return createMonitor(config, new TelegramGiftPlatformAdapter(api), createNotifier(config, api), NewGiftListener.NOOP);
    }

    /** Wiring with an explicit platform/notifier. */
    public static GiftMonitor createMonitor(ConfigPort config,
                                            GiftPlatformPort platform,
                                            NotifierPort notifier,
                                            NewGiftListener listener) {
        AcquisitionSettings settings = AcquisitionSettings.fromConfig(config);
        AcquisitionReporter reporter = new AcquisitionReporter(notifier, Messages.forLanguage(settings.language()));

        SnapshotStorePort snapshots = new JsonFileSnapshotStore(
                Path.of(config.get(ConfigKey.SNAPSHOT_FILE.key(), DEFAULT_SNAPSHOT_FILE)));

        PurchaseOrchestrator orchestrator = new PurchaseOrchestrator(
                platform,
                new PurchaseThrottle(settings.purchaseDelay()),
                new PurchaseErrorClassifier(),
                reporter);

        return new GiftMonitor(platform, snapshots, settings, orchestrator, reporter, listener, new BotStateManager());
    }

    /** Telegram chat when telegram.channelId is usable, console otherwise. */
    static NotifierPort createNotifier(ConfigPort config, TelegramBotApiClient api) {
        String chat = ChannelIds.normalize(config.get(ConfigKey.TELEGRAM_CHANNEL_ID.key(), ""));
        if (chat == null) {
            log.info("No notification channel configured, notifications go to the console");
            return new ConsoleNotifier();
        }
        return new TelegramNotifier(api, chat);
    }

    static void applyLogLevel(String level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger lb) {
            lb.setLevel(Level.toLevel(level, Level.INFO));
        }
    }
}
