package com.giftsbuyer.domain.purchase;

/**
 * Final outcome of one recipient's purchase sequence.
 *
 * - Success: every requested unit was bought (currentIndex == totalRequested).
 * - PartialFailure: a failure after at least one unit was bought.
 * - Aborted: nothing was bought for this recipient.
 */
public interface PurchaseOutcome {

    boolean successful();

    int purchased();

    record Success(int currentIndex, int totalRequested) implements PurchaseOutcome {
        @Override public boolean successful() { return true; }
        @Override public int purchased() { return currentIndex; }
    }

    record PartialFailure(PurchaseErrorKind reason, int purchasedSoFar) implements PurchaseOutcome {
        @Override public boolean successful() { return false; }
        @Override public int purchased() { return purchasedSoFar; }
    }

    record Aborted(PurchaseErrorKind reason) implements PurchaseOutcome {
        @Override public boolean successful() { return false; }
        @Override public int purchased() { return 0; }
    }
}
