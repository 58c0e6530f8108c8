package com.giftsbuyer.domain.acquisition;

import java.util.Objects;

/**
 * Destination of purchased gifts: either a numeric user id or a handle (without '@').
 */
public record Recipient(Long userId, String handle) {

    public Recipient {
        if ((userId == null) == (handle == null)) {
            throw new IllegalArgumentException("recipient must have exactly one of userId or handle");
        }
        if (handle != null && handle.isBlank()) {
            throw new IllegalArgumentException("recipient handle must not be blank");
        }
    }

    public static Recipient ofId(long userId) {
        return new Recipient(userId, null);
    }

    public static Recipient ofHandle(String handle) {
        Objects.requireNonNull(handle, "handle");
        String h = handle.startsWith("@") ? handle.substring(1) : handle;
        return new Recipient(null, h);
    }

    /**
     * Parses a configured recipient token.
     * "@name" is a handle, digits are a user id, anything else is treated as a handle.
     */
    public static Recipient parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty recipient");
        }
        String t = raw.trim();
        if (t.startsWith("@")) return ofHandle(t);
        if (t.chars().allMatch(Character::isDigit)) {
            try {
                return ofId(Long.parseLong(t));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("recipient id out of range: " + t, e);
            }
        }
        return ofHandle(t);
    }

    public boolean hasUserId() {
        return userId != null;
    }

    /** Raw reference used when the platform cannot resolve the recipient. */
    public String raw() {
        return hasUserId() ? String.valueOf(userId) : "@" + handle;
    }

    @Override
    public String toString() {
        return raw();
    }
}
