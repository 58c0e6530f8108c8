package com.giftsbuyer.domain.acquisition;

import java.util.List;

/**
 * Result of evaluating one gift.
 *
 * Eligible verdicts carry quantity + recipients; excluded ones carry the reason.
 * price/totalAmount are kept for range_error diagnostics.
 */
public record EligibilityVerdict(boolean eligible,
                                 int quantity,
                                 List<Recipient> recipients,
                                 ExclusionReason exclusionReason,
                                 int price,
                                 int totalAmount) {

    public EligibilityVerdict {
        recipients = (recipients == null) ? List.of() : List.copyOf(recipients);
    }

    public static EligibilityVerdict eligible(int quantity, List<Recipient> recipients) {
        return new EligibilityVerdict(true, quantity, recipients, null, 0, 0);
    }

    public static EligibilityVerdict excluded(ExclusionReason reason) {
        return new EligibilityVerdict(false, 0, List.of(), reason, 0, 0);
    }

    public static EligibilityVerdict rangeError(int price, int totalAmount) {
        return new EligibilityVerdict(false, 0, List.of(), ExclusionReason.RANGE_ERROR, price, totalAmount);
    }
}
