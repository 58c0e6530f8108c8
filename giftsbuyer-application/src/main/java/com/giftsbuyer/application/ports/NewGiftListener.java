package com.giftsbuyer.application.ports;

import com.giftsbuyer.domain.acquisition.RankedGift;

/**
 * Callback invoked once per newly detected gift, in priority order,
 * before the gift is evaluated.
 */
@FunctionalInterface
public interface NewGiftListener {

    NewGiftListener NOOP = gift -> { };

    void onNewGift(RankedGift gift);
}
