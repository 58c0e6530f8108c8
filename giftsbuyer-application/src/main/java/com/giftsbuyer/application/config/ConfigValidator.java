package com.giftsbuyer.application.config;

import com.giftsbuyer.application.ports.ConfigPort;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;

            String v = k.isSecret() ? config.getSecret(k.key()) : config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
            }
        }

        String rawRanges = config.get(ConfigKey.GIFT_RANGES.key(), "");
        if (!rawRanges.isBlank()) {
            RangeSpecParser.Result parsed = new RangeSpecParser().parse(rawRanges);
            res.addAll(parsed.errors());
            if (parsed.ranges().isEmpty() && parsed.errors().isEmpty()) {
                res.addError("gifts.ranges contains no ranges");
            }
        }

        double interval = config.getDouble(ConfigKey.BOT_INTERVAL.key(), AcquisitionSettings.DEFAULT_INTERVAL_SECONDS);
        if (!(interval > 0)) {
            res.addError("bot.interval must be > 0 seconds");
        }

        String url = config.get(ConfigKey.TELEGRAM_API_URL.key(), "");
        if (!url.isBlank() && !(url.startsWith("http://") || url.startsWith("https://"))) {
            res.addError("telegram.apiUrl must start with http:// or https://");
        }

        return res;
    }
}
