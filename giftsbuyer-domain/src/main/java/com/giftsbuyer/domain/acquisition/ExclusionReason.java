package com.giftsbuyer.domain.acquisition;

public enum ExclusionReason {
    SOLD_OUT("sold_out"),
    NON_LIMITED_BLOCKED("non_limited_blocked"),
    NON_UPGRADABLE_BLOCKED("non_upgradable_blocked"),
    RANGE_ERROR("range_error");

    private final String code;

    ExclusionReason(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
