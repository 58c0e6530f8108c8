package com.giftsbuyer.application.purchase;

import com.giftsbuyer.domain.purchase.Affordability;

import java.util.List;

/**
 * What happened for one gift.
 * remainingBalance is only filled when a partial-purchase report was produced.
 */
public record ItemAcquisitionReport(String giftId,
                                    Affordability affordability,
                                    List<RecipientResult> results,
                                    Long remainingBalance) {

    public ItemAcquisitionReport {
        results = List.copyOf(results);
    }

    public int totalPurchased() {
        int sum = 0;
        for (RecipientResult r : results) sum += r.outcome().purchased();
        return sum;
    }
}
