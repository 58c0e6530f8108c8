package com.giftsbuyer.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.giftsbuyer.application.ports.PlatformException;
import com.giftsbuyer.application.ports.RecipientInfo;
import com.giftsbuyer.domain.acquisition.Recipient;
import com.giftsbuyer.domain.gift.Gift;
import com.giftsbuyer.domain.purchase.PurchaseErrorClassifier;
import com.giftsbuyer.domain.purchase.PurchaseErrorKind;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelegramGiftPlatformAdapterTest {

    private static final String TOKEN = "123:secret";

    private final ObjectMapper om = new ObjectMapper();
    private MockWebServer server;
    private TelegramGiftPlatformAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient http = new OkHttpClient.Builder()
                .readTimeout(2, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
        String base = server.url("/").toString();
        adapter = new TelegramGiftPlatformAdapter(new TelegramBotApiClient(base, TOKEN, http, om));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void reply(String json) {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(json));
    }

    private void reply(int status, String json) {
        server.enqueue(new MockResponse().setResponseCode(status).setBody(json));
    }

    private JsonNode body(RecordedRequest req) throws IOException {
        return om.readTree(req.getBody().readUtf8());
    }

    @Test
    void connectCallsGetMe() throws Exception {
        reply("{\"ok\":true,\"result\":{\"id\":1,\"is_bot\":true,\"username\":\"gifts_bot\"}}");

        assertThat(adapter.isConnected()).isFalse();
        adapter.connect();

        assertThat(adapter.isConnected()).isTrue();
        assertThat(adapter.botUsername()).isEqualTo("gifts_bot");
        assertThat(server.takeRequest().getPath()).isEqualTo("/bot" + TOKEN + "/getMe");
    }

    @Test
    void mapsCatalogInPlatformOrder() throws Exception {
        reply("""
                {"ok":true,"result":{"gifts":[
                  {"id":"111","sticker":{},"star_count":15},
                  {"id":"222","sticker":{},"star_count":500,"total_count":10000,"remaining_count":0},
                  {"id":"333","sticker":{},"star_count":50,"total_count":2000,"remaining_count":5,"upgrade_star_count":25}
                ]}}
                """);

        List<Gift> gifts = adapter.listAvailableGifts();

        assertThat(gifts).containsExactly(
                new Gift("111", 15, false, false, null, null, null),
                new Gift("222", 500, true, true, 10000, 0, null),
                new Gift("333", 50, true, false, 2000, 5, 25));
    }

    @Test
    void readsStarBalance() throws Exception {
        reply("{\"ok\":true,\"result\":{\"amount\":1234,\"nanostar_amount\":0}}");

        assertThat(adapter.getBalance()).isEqualTo(1234L);
        assertThat(server.takeRequest().getPath()).endsWith("/getMyStarBalance");
    }

    @Test
    void purchaseSendsUserIdOrHandle() throws Exception {
        reply("{\"ok\":true,\"result\":true}");
        reply("{\"ok\":true,\"result\":true}");

        adapter.purchase(Recipient.ofId(42L), "333");
        adapter.purchase(Recipient.ofHandle("alice"), "333");

        JsonNode byId = body(server.takeRequest());
        assertThat(byId.path("gift_id").asText()).isEqualTo("333");
        assertThat(byId.path("user_id").asLong()).isEqualTo(42L);

        RecordedRequest second = server.takeRequest();
        assertThat(second.getPath()).endsWith("/sendGift");
        assertThat(body(second).path("chat_id").asText()).isEqualTo("@alice");
    }

    @Test
    void errorReplyCarriesTheSymbolicCode() {
        reply(400, "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: BALANCE_TOO_LOW\"}");

        assertThatThrownBy(() -> adapter.purchase(Recipient.ofId(1L), "333"))
                .isInstanceOfSatisfying(PlatformException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo("BALANCE_TOO_LOW");
                    assertThat(e.status()).isEqualTo(400);
                    assertThat(new PurchaseErrorClassifier().classify(e)).isEqualTo(PurchaseErrorKind.BALANCE_TOO_LOW);
                });
    }

    @Test
    void resolvesRecipientUsername() throws Exception {
        reply("{\"ok\":true,\"result\":{\"id\":42,\"type\":\"private\",\"username\":\"bob\"}}");
        reply("{\"ok\":true,\"result\":{\"id\":43,\"type\":\"private\"}}");

        assertThat(adapter.resolveRecipient(Recipient.ofId(42L))).isEqualTo(new RecipientInfo("@bob", "bob"));
        assertThat(adapter.resolveRecipient(Recipient.ofId(43L))).isEqualTo(new RecipientInfo("43", ""));
    }

    @Test
    void transportFailureDropsTheConnection() throws Exception {
        reply("{\"ok\":true,\"result\":{\"username\":\"gifts_bot\"}}");
        adapter.connect();
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        assertThatThrownBy(adapter::listAvailableGifts)
                .isInstanceOfSatisfying(PlatformException.class, e -> assertThat(e.status()).isEqualTo(-1));
        assertThat(adapter.isConnected()).isFalse();
    }

    @Test
    void nonJsonReplyIsAPlatformFailure() {
        reply(502, "<html>Bad Gateway</html>");

        assertThatThrownBy(adapter::getBalance)
                .isInstanceOfSatisfying(PlatformException.class, e -> assertThat(e.status()).isEqualTo(502));
    }
}
