package com.giftsbuyer.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.giftsbuyer.application.ports.GiftPlatformPort;
import com.giftsbuyer.application.ports.PlatformException;
import com.giftsbuyer.application.ports.RecipientInfo;
import com.giftsbuyer.domain.acquisition.Recipient;
import com.giftsbuyer.domain.gift.Gift;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link GiftPlatformPort} over the Telegram Bot API.
 *
 * Bot API calls are stateless; "connected" means getMe succeeded and no transport
 * failure has been seen since.
 */
public class TelegramGiftPlatformAdapter implements GiftPlatformPort {

    private static final Logger log = LoggerFactory.getLogger(TelegramGiftPlatformAdapter.class);

    private final TelegramBotApiClient api;
    private volatile boolean connected;
    private volatile String botUsername;

    public TelegramGiftPlatformAdapter(TelegramBotApiClient api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void connect() throws PlatformException {
        JsonNode me = call("getMe", Map.of());
        botUsername = me.path("username").asText("");
        connected = true;
        log.info("Connected to Telegram as @{}", botUsername);
    }

    public String botUsername() {
        return botUsername;
    }

    @Override
    public List<Gift> listAvailableGifts() throws PlatformException {
        JsonNode result = call("getAvailableGifts", Map.of());
        List<Gift> gifts = new ArrayList<>();
        for (JsonNode node : result.path("gifts")) {
            Gift g = toGift(node);
            if (g != null) gifts.add(g);
        }
        return gifts;
    }

    @Override
    public long getBalance() throws PlatformException {
        return call("getMyStarBalance", Map.of()).path("amount").asLong(0L);
    }

    @Override
    public RecipientInfo resolveRecipient(Recipient recipient) throws PlatformException {
        JsonNode chat = call("getChat", Map.of("chat_id", chatRef(recipient)));
        String username = chat.path("username").asText("");
        if (!username.isEmpty()) return new RecipientInfo("@" + username, username);
        return new RecipientInfo(recipient.raw(), recipient.hasUserId() ? "" : recipient.handle());
    }

    @Override
    public void purchase(Recipient recipient, String giftId) throws PlatformException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("gift_id", giftId);
        if (recipient.hasUserId()) {
            params.put("user_id", recipient.userId());
        } else {
            params.put("chat_id", "@" + recipient.handle());
        }
        call("sendGift", params);
    }

    private JsonNode call(String method, Map<String, ?> params) throws PlatformException {
        try {
            return api.call(method, params);
        } catch (PlatformException e) {
            // status -1: transport failure, re-check the session next cycle
            if (e.status() < 0) connected = false;
            throw e;
        }
    }

    private static Object chatRef(Recipient recipient) {
        return recipient.hasUserId() ? recipient.userId() : "@" + recipient.handle();
    }

    /**
     * Bot API Gift object:
     * id, star_count, upgrade_star_count?, total_count?, remaining_count?
     */
    static Gift toGift(JsonNode node) {
        String id = node.path("id").asText("");
        if (id.isBlank()) {
            log.warn("Skipping gift without id: {}", node);
            return null;
        }
        int price = node.path("star_count").asInt(0);
        Integer total = optInt(node, "total_count");
        Integer remaining = optInt(node, "remaining_count");
        Integer upgrade = optInt(node, "upgrade_star_count");

        boolean limited = total != null;
        boolean soldOut = limited && remaining != null && remaining == 0;
        return new Gift(id, price, limited, soldOut, total, remaining, upgrade);
    }

    private static Integer optInt(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asInt();
    }
}
