package com.giftsbuyer.application.config;

/**
 * Known configuration keys.
 * Secrets are stored in secrets.properties or the environment.
 */
public enum ConfigKey {
    TELEGRAM_BOT_TOKEN("TELEGRAM_BOT_TOKEN", true, false),
    TELEGRAM_API_URL("telegram.apiUrl", false, true),
    TELEGRAM_CHANNEL_ID("telegram.channelId", false, true),

    BOT_INTERVAL("bot.interval", false, true),
    BOT_LANGUAGE("bot.language", false, true),

    GIFT_RANGES("gifts.ranges", false, false),
    UPGRADABLE_ONLY("gifts.upgradableOnly", false, true),
    PRIORITIZE_LOW_SUPPLY("gifts.prioritizeLowSupply", false, true),

    PURCHASE_DELAY_MS("purchase.delayMs", false, true),
    SNAPSHOT_FILE("snapshot.file", false, true),

    LOG_LEVEL("log.level", false, true);

    private final String key;
    private final boolean secret;
    private final boolean optional;

    ConfigKey(String key, boolean secret, boolean optional) {
        this.key = key;
        this.secret = secret;
        this.optional = optional;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public boolean isOptional() { return optional; }
}
