package com.giftsbuyer.domain.purchase;

import java.util.List;

/**
 * Closed taxonomy of purchase failures.
 * Each kind lists the platform error codes that map to it.
 */
public enum PurchaseErrorKind {
    BALANCE_TOO_LOW("balance_too_low", List.of("BALANCE_TOO_LOW")),
    USAGE_LIMITED("usage_limited", List.of("STARGIFT_USAGE_LIMITED")),
    INVALID_RECIPIENT("invalid_recipient", List.of("PEER_ID_INVALID", "USER_ID_INVALID")),
    UNCLASSIFIED("unclassified", List.of());

    private final String code;
    private final List<String> platformCodes;

    PurchaseErrorKind(String code, List<String> platformCodes) {
        this.code = code;
        this.platformCodes = platformCodes;
    }

    public String code() { return code; }

    public List<String> platformCodes() { return platformCodes; }
}
