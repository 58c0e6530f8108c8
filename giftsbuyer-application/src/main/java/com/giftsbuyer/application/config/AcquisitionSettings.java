package com.giftsbuyer.application.config;

import com.giftsbuyer.application.ports.ConfigPort;
import com.giftsbuyer.domain.acquisition.AcquisitionRange;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Immutable engine configuration, built once at startup and passed to the monitor and
 * the purchase orchestrator.
 */
public record AcquisitionSettings(List<AcquisitionRange> ranges,
                                  boolean upgradableOnly,
                                  boolean prioritizeLowSupply,
                                  Duration interval,
                                  Duration purchaseDelay,
                                  String language) {

    /** Upstream rate limit: successive purchase calls are never closer than this. */
    public static final Duration MIN_PURCHASE_DELAY = Duration.ofMillis(500);

    public static final double DEFAULT_INTERVAL_SECONDS = 15.0;
    public static final String DEFAULT_LANGUAGE = "en";

    public AcquisitionSettings {
        ranges = List.copyOf(ranges);
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (purchaseDelay == null || purchaseDelay.compareTo(MIN_PURCHASE_DELAY) < 0) {
            purchaseDelay = MIN_PURCHASE_DELAY;
        }
        language = (language == null || language.isBlank())
                ? DEFAULT_LANGUAGE
                : language.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Builds settings from validated configuration.
     * Invalid range entries are dropped here; {@link ConfigValidator} reports them.
     */
    public static AcquisitionSettings fromConfig(ConfigPort config) {
        RangeSpecParser.Result parsed = new RangeSpecParser().parse(config.get(ConfigKey.GIFT_RANGES.key(), ""));
        double intervalSeconds = config.getDouble(ConfigKey.BOT_INTERVAL.key(), DEFAULT_INTERVAL_SECONDS);
        long delayMs = config.getInt(ConfigKey.PURCHASE_DELAY_MS.key(), (int) MIN_PURCHASE_DELAY.toMillis());

        return new AcquisitionSettings(
                parsed.ranges(),
                config.getBoolean(ConfigKey.UPGRADABLE_ONLY.key(), false),
                config.getBoolean(ConfigKey.PRIORITIZE_LOW_SUPPLY.key(), false),
                Duration.ofMillis(Math.round(intervalSeconds * 1000.0)),
                Duration.ofMillis(delayMs),
                config.get(ConfigKey.BOT_LANGUAGE.key(), DEFAULT_LANGUAGE)
        );
    }
}
