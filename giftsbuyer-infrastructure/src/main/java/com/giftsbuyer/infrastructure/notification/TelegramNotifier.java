package com.giftsbuyer.infrastructure.notification;

import com.giftsbuyer.application.ports.NotifierPort;
import com.giftsbuyer.application.ports.PlatformException;
import com.giftsbuyer.infrastructure.telegram.TelegramBotApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sends operator notifications to a Telegram chat via sendMessage.
 *
 * Core notifier must be PLAIN text: no parse_mode, so gift ids and error texts are never
 * parsed as markup. Delivery failures are logged and dropped.
 */
public class TelegramNotifier implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private final TelegramBotApiClient api;
    private final String chatId;

    public TelegramNotifier(TelegramBotApiClient api, String chatId) {
        this.api = Objects.requireNonNull(api, "api");
        if (chatId == null || chatId.isBlank()) throw new IllegalArgumentException("chatId is required");
        this.chatId = chatId;
    }

    @Override
    public void send(String text) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("chat_id", chatId);
        params.put("text", text);
        params.put("disable_web_page_preview", true);
        try {
            api.call("sendMessage", params);
        } catch (PlatformException e) {
            log.warn("Telegram sendMessage to {} failed: {}", chatId, e.getMessage());
        }
    }

    public String chatId() {
        return chatId;
    }
}
