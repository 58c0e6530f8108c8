package com.giftsbuyer.domain.acquisition;

import java.util.List;

/**
 * Configured price band + supply ceiling mapped to a per-recipient quantity.
 * Bounds are inclusive.
 */
public record AcquisitionRange(int minPrice,
                               int maxPrice,
                               int supplyLimit,
                               int quantity,
                               List<Recipient> recipients) {

    public AcquisitionRange {
        if (minPrice < 0) throw new IllegalArgumentException("minPrice must be >= 0");
        if (maxPrice < minPrice) throw new IllegalArgumentException("maxPrice must be >= minPrice");
        if (supplyLimit < 0) throw new IllegalArgumentException("supplyLimit must be >= 0");
        if (quantity <= 0) throw new IllegalArgumentException("quantity must be > 0");
        if (recipients == null || recipients.isEmpty()) {
            throw new IllegalArgumentException("range needs at least one recipient");
        }
        recipients = List.copyOf(recipients);
    }

    public boolean matches(int price, int totalAmount) {
        return minPrice <= price && price <= maxPrice && totalAmount <= supplyLimit;
    }

    public String describe() {
        return minPrice + "-" + maxPrice + " (supply<=" + supplyLimit + ") x" + quantity + " -> " + recipients;
    }
}
