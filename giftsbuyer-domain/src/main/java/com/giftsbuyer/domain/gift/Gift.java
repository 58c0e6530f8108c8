package com.giftsbuyer.domain.gift;

import java.util.Objects;

/**
 * A catalog entry as returned by the platform.
 *
 * - totalAmount is meaningful only for limited gifts (supply cap).
 * - upgradePrice present means the gift is upgradable.
 * - remainingAmount is informational only; no decision depends on it.
 *
 * Gifts are never patched: every poll produces fresh instances.
 */
public record Gift(String id,
                   int price,
                   boolean limited,
                   boolean soldOut,
                   Integer totalAmount,
                   Integer remainingAmount,
                   Integer upgradePrice) {

    public Gift {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("gift id must not be blank");
    }

    public boolean upgradable() {
        return upgradePrice != null;
    }

    /** Supply used for range matching: totalAmount for limited gifts, otherwise 0. */
    public int supplyForMatching() {
        if (!limited || totalAmount == null) return 0;
        return totalAmount;
    }

    /** Supply used for low-supply ordering: unlimited or unknown supply sorts last. */
    public long supplyForOrdering() {
        if (!limited || totalAmount == null) return Long.MAX_VALUE;
        return totalAmount;
    }

    public Gift withPrice(int newPrice) {
        return new Gift(id, newPrice, limited, soldOut, totalAmount, remainingAmount, upgradePrice);
    }
}
