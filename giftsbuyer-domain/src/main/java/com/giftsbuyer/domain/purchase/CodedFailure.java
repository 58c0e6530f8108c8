package com.giftsbuyer.domain.purchase;

/**
 * Implemented by failures that carry a structured platform error code
 * (e.g. "BALANCE_TOO_LOW"). The code may be null when the platform did not provide one.
 */
public interface CodedFailure {
    String errorCode();
}
