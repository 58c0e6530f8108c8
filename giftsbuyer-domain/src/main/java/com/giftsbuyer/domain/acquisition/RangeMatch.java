package com.giftsbuyer.domain.acquisition;

import java.util.List;

public record RangeMatch(boolean matched, int quantity, List<Recipient> recipients) {

    public static final RangeMatch NONE = new RangeMatch(false, 0, List.of());

    public RangeMatch {
        recipients = (recipients == null) ? List.of() : List.copyOf(recipients);
    }

    public static RangeMatch of(AcquisitionRange range) {
        return new RangeMatch(true, range.quantity(), range.recipients());
    }
}
