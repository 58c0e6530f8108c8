package com.giftsbuyer.infrastructure.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.giftsbuyer.application.ports.PlatformException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thin Telegram Bot API client:
 *  - POST {baseUrl}/bot{token}/{method} with a JSON body
 *  - returns the "result" node of an ok reply
 *  - ok=false replies become {@link PlatformException} with the upper-case token of the
 *    description as error code ("Bad Request: BALANCE_TOO_LOW" -> BALANCE_TOO_LOW)
 *
 * The token is never logged.
 */
public class TelegramBotApiClient {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotApiClient.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final Pattern ERROR_TOKEN = Pattern.compile("\\b[A-Z][A-Z0-9]*(?:_[A-Z0-9]+)+\\b");

    public static final String DEFAULT_BASE_URL = "https://api.telegram.org";

    private final String baseUrl;
    private final String botToken;
    private final OkHttpClient http;
    private final ObjectMapper om;

    public TelegramBotApiClient(String baseUrl, String botToken) {
        this(baseUrl, botToken, new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build(), new ObjectMapper());
    }

    public TelegramBotApiClient(String baseUrl, String botToken, OkHttpClient http, ObjectMapper om) {
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalArgumentException("bot token is required");
        }
        String url = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : baseUrl.trim();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.botToken = botToken.trim();
        this.http = Objects.requireNonNull(http, "http");
        this.om = Objects.requireNonNull(om, "om");
    }

    public JsonNode call(String method) throws PlatformException {
        return call(method, Map.of());
    }

    /**
     * Invokes a Bot API method.
     *
     * @throws PlatformException on transport failure, unparsable reply or ok=false
     */
    public JsonNode call(String method, Map<String, ?> params) throws PlatformException {
        String body;
        try {
            body = om.writeValueAsString(params == null ? Map.of() : params);
        } catch (JsonProcessingException e) {
            throw new PlatformException("Cannot encode " + method + " parameters", e);
        }

        Request request = new Request.Builder()
                .url(baseUrl + "/bot" + botToken + "/" + method)
                .post(RequestBody.create(body, JSON))
                .build();

        String text;
        int httpStatus;
        try (Response resp = http.newCall(request).execute()) {
            httpStatus = resp.code();
            text = (resp.body() != null) ? resp.body().string() : "";
        } catch (IOException e) {
            throw new PlatformException(method + " failed: " + e.getMessage(), null, -1, e);
        }

        JsonNode root;
        try {
            root = om.readTree(text);
        } catch (JsonProcessingException e) {
            throw new PlatformException(method + " returned HTTP " + httpStatus + " with a non-JSON body", null, httpStatus, e);
        }
        if (root == null || !root.isObject()) {
            throw new PlatformException(method + " returned HTTP " + httpStatus + " with an empty body", null, httpStatus);
        }

        if (root.path("ok").asBoolean(false)) {
            return root.path("result");
        }

        String description = root.path("description").asText("HTTP " + httpStatus);
        int errorCode = root.path("error_code").asInt(httpStatus);
        log.debug("Bot API {} rejected: {} ({})", method, description, errorCode);
        throw new PlatformException(description, errorToken(description), errorCode);
    }

    /** Upper-case symbolic token of an error description, or null when there is none. */
    static String errorToken(String description) {
        if (description == null) return null;
        Matcher m = ERROR_TOKEN.matcher(description);
        String last = null;
        while (m.find()) last = m.group();
        return last;
    }
}
