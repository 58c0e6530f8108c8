package com.giftsbuyer.application.config;

/**
 * Normalizes the notification channel value into a chat reference.
 *
 * - empty or "-100" -> null (notifications go to the console only)
 * - "@name"         -> "@name"
 * - "-100123..."    -> "-100123..."
 * - "123"           -> "123" ("0" -> null)
 * - anything else   -> "@" + value
 */
public final class ChannelIds {

    private ChannelIds() {}

    public static String normalize(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.isEmpty() || "-100".equals(v)) return null;
        if (v.startsWith("@")) return v;
        if (v.startsWith("-") && isDigits(v.substring(1))) return v;
        if (isDigits(v)) return isZero(v) ? null : v;
        return "@" + v;
    }

    private static boolean isDigits(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }

    private static boolean isZero(String s) {
        return s.chars().allMatch(c -> c == '0');
    }
}
