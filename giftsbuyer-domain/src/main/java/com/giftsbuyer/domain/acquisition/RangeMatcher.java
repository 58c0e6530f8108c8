package com.giftsbuyer.domain.acquisition;

import java.util.List;

/**
 * First-hit lookup over configured ranges.
 * Overlapping ranges are allowed; declaration order decides.
 */
public final class RangeMatcher {

    private final List<AcquisitionRange> ranges;

    public RangeMatcher(List<AcquisitionRange> ranges) {
        this.ranges = (ranges == null) ? List.of() : List.copyOf(ranges);
    }

    public RangeMatch match(int price, int totalAmount) {
        for (AcquisitionRange r : ranges) {
            if (r.matches(price, totalAmount)) return RangeMatch.of(r);
        }
        return RangeMatch.NONE;
    }

    public List<AcquisitionRange> ranges() {
        return ranges;
    }
}
