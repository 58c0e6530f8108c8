package com.giftsbuyer.cli.bootstrap;

import com.giftsbuyer.application.engine.CycleReport;
import com.giftsbuyer.application.engine.GiftMonitor;
import com.giftsbuyer.application.ports.GiftPlatformPort;
import com.giftsbuyer.application.ports.RecipientInfo;
import com.giftsbuyer.cli.tools.StubConfig;
import com.giftsbuyer.domain.acquisition.Recipient;
import com.giftsbuyer.domain.gift.Gift;
import com.giftsbuyer.infrastructure.notification.ConsoleNotifier;
import com.giftsbuyer.infrastructure.notification.TelegramNotifier;
import com.giftsbuyer.infrastructure.telegram.TelegramBotApiClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BootstrapTest {

    @TempDir
    Path dir;

    private final TelegramBotApiClient api = new TelegramBotApiClient(null, "token");

    @Test
    void consoleNotifierWithoutChannel() {
        assertThat(Bootstrap.createNotifier(new StubConfig(), api)).isInstanceOf(ConsoleNotifier.class);
        assertThat(Bootstrap.createNotifier(new StubConfig().with("telegram.channelId", "-100"), api))
                .isInstanceOf(ConsoleNotifier.class);
    }

    @Test
    void telegramNotifierForChannel() {
        assertThat(Bootstrap.createNotifier(new StubConfig().with("telegram.channelId", "news"), api))
                .isInstanceOfSatisfying(TelegramNotifier.class, n -> assertThat(n.chatId()).isEqualTo("@news"));
    }

    @Test
    void wiredMonitorBuysAndPersists() {
        Path snapshot = dir.resolve("data/history.json");
        StubConfig cfg = new StubConfig()
                .with("TELEGRAM_BOT_TOKEN", "token")
                .with("gifts.ranges", "1-100: 1000 x 1: 42")
                .with("snapshot.file", snapshot.toString());
        List<String> bought = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        GiftMonitor monitor = Bootstrap.createMonitor(cfg, new GiftPlatformPort() {
            @Override public boolean isConnected() { return true; }
            @Override public void connect() { }
            @Override public List<Gift> listAvailableGifts() {
                return List.of(new Gift("g", 10, true, false, 500, 500, null));
            }
            @Override public long getBalance() { return 100; }
            @Override public RecipientInfo resolveRecipient(Recipient r) { return new RecipientInfo(r.raw(), ""); }
            @Override public void purchase(Recipient r, String giftId) { bought.add(giftId + "->" + r.raw()); }
        }, notes::add, null);

        CycleReport report = monitor.runCycle();

        assertThat(report.completed()).isTrue();
        assertThat(bought).containsExactly("g->42");
        assertThat(notes).anySatisfy(n -> assertThat(n).contains("sent to 42"));
        assertThat(Files.exists(snapshot)).isTrue();
    }
}
