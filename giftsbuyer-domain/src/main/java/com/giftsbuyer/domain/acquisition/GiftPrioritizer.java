package com.giftsbuyer.domain.acquisition;

import com.giftsbuyer.domain.gift.Gift;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders a batch of new gifts for processing.
 *
 * 1) position = size(discoveryOrder) - indexOf(id); sort ascending by position.
 * 2) low-supply mode: re-sort (stable) by supply ascending, unlimited last, position as tie-break.
 *
 * Pass 1 always runs; pass 2 only refines it.
 */
public final class GiftPrioritizer {

    private static final Comparator<RankedGift> BY_POSITION =
            Comparator.comparingInt(RankedGift::position);

    private static final Comparator<RankedGift> BY_SUPPLY_THEN_POSITION =
            Comparator.comparingLong((RankedGift r) -> r.gift().supplyForOrdering())
                    .thenComparingInt(RankedGift::position);

    private final boolean prioritizeLowSupply;

    public GiftPrioritizer(boolean prioritizeLowSupply) {
        this.prioritizeLowSupply = prioritizeLowSupply;
    }

    public List<RankedGift> prioritize(Map<String, Gift> gifts, List<String> discoveryOrder) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < discoveryOrder.size(); i++) {
            index.putIfAbsent(discoveryOrder.get(i), i);
        }

        int size = discoveryOrder.size();
        List<RankedGift> ranked = new ArrayList<>(gifts.size());
        for (Map.Entry<String, Gift> e : gifts.entrySet()) {
            Integer idx = index.get(e.getKey());
            if (idx == null) {
                throw new IllegalArgumentException("gift " + e.getKey() + " missing from discovery order");
            }
            ranked.add(new RankedGift(e.getValue(), size - idx));
        }

        ranked.sort(BY_POSITION);
        if (prioritizeLowSupply) {
            ranked.sort(BY_SUPPLY_THEN_POSITION);
        }
        return ranked;
    }
}
