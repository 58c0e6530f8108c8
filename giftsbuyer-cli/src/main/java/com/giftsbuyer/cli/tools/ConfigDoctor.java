package com.giftsbuyer.cli.tools;

import com.giftsbuyer.application.config.AcquisitionSettings;
import com.giftsbuyer.application.config.ConfigKey;
import com.giftsbuyer.application.config.ConfigValidationResult;
import com.giftsbuyer.application.config.ConfigValidator;
import com.giftsbuyer.application.ports.ConfigPort;
import com.giftsbuyer.domain.acquisition.AcquisitionRange;

import java.io.PrintStream;

/**
 * Configuration diagnostics.
 *
 * Usage:
 *   java -jar giftsbuyer-cli.jar validate-config
 *
 * Exit codes:
 *   0: OK
 *   2: Problems found
 */
public final class ConfigDoctor {

    private ConfigDoctor() {}

    public static int run(ConfigPort cfg, PrintStream out) {
        ConfigValidationResult res = new ConfigValidator().validate(cfg);

        out.println("Config (masked)");
        for (ConfigKey k : ConfigKey.values()) {
            String v = k.isSecret() ? cfg.getSecret(k.key()) : cfg.get(k.key());
            out.println(" - " + k.key() + " = " + (k.isSecret() ? mask(v) : orEmpty(v)));
        }

        if (!res.isValid()) {
            out.println("❌ Config problems:");
            for (String err : res.errors()) {
                out.println(" - " + err);
            }
            out.println("\nTips:");
            out.println(" - Edit config/config.properties (or config/.env)");
            out.println(" - Or set env overrides like GIFTS_GIFTS_RANGES, TELEGRAM_BOT_TOKEN, ...");
            return 2;
        }

        AcquisitionSettings s = AcquisitionSettings.fromConfig(cfg);
        out.println("\nRanges (in match order)");
        for (AcquisitionRange r : s.ranges()) {
            out.println(" - " + r.describe());
        }
        out.println("✅ Config OK.");
        return 0;
    }

    static String mask(String v) {
        if (v == null || v.isBlank()) return "<empty>";
        String t = v.trim();
        if (t.length() <= 6) return "***";
        return t.substring(0, 2) + "***" + t.substring(t.length() - 2);
    }

    private static String orEmpty(String v) {
        return (v == null || v.isBlank()) ? "<empty>" : v;
    }
}
