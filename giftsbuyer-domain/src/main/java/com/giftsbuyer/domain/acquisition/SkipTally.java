package com.giftsbuyer.domain.acquisition;

import com.giftsbuyer.domain.gift.Gift;

import java.util.Collection;

/**
 * Per-batch skip counters. Categories are independent: one gift may count in several.
 */
public record SkipTally(int soldOut, int nonLimited, int nonUpgradable) {

    public static final SkipTally ZERO = new SkipTally(0, 0, 0);

    public static SkipTally of(Collection<Gift> gifts, boolean upgradableOnly) {
        int soldOut = 0;
        int nonLimited = 0;
        int nonUpgradable = 0;
        for (Gift g : gifts) {
            if (g.soldOut()) soldOut++;
            if (!g.limited()) nonLimited++;
            if (upgradableOnly && !g.upgradable()) nonUpgradable++;
        }
        return new SkipTally(soldOut, nonLimited, nonUpgradable);
    }

    public boolean any() {
        return soldOut > 0 || nonLimited > 0 || nonUpgradable > 0;
    }
}
