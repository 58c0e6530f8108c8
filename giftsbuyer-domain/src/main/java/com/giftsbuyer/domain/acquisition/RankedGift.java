package com.giftsbuyer.domain.acquisition;

import com.giftsbuyer.domain.gift.Gift;

/**
 * A gift with its position in the current catalog (distance from the end of the list).
 * Recomputed every cycle; never persisted.
 */
public record RankedGift(Gift gift, int position) {

    public String id() {
        return gift.id();
    }
}
