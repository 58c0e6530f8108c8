package com.giftsbuyer.domain.acquisition;

import com.giftsbuyer.domain.gift.Gift;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EligibilityEvaluatorTest {

    private static final Recipient ALICE = Recipient.ofHandle("alice");

    private final RangeMatcher matcher = new RangeMatcher(List.of(
            new AcquisitionRange(1, 1000, 10_000, 3, List.of(ALICE)),
            // only reachable for non-limited supply (0)
            new AcquisitionRange(2000, 3000, 0, 1, List.of(ALICE))
    ));

    private static Gift limited(String id, int price, int total, Integer upgrade) {
        return new Gift(id, price, true, false, total, total, upgrade);
    }

    @Test
    void soldOutWinsOverEveryOtherRule() {
        Gift g = new Gift("s", 5000, false, true, null, 0, null);

        EligibilityVerdict v = new EligibilityEvaluator(matcher, true).evaluate(g);

        assertThat(v.eligible()).isFalse();
        assertThat(v.exclusionReason()).isEqualTo(ExclusionReason.SOLD_OUT);
    }

    @Test
    void nonLimitedIsBlockedEvenWhenARangeWouldMatch() {
        Gift g = new Gift("n", 2500, false, false, null, null, null);

        EligibilityVerdict v = new EligibilityEvaluator(matcher, false).evaluate(g);

        assertThat(v.exclusionReason()).isEqualTo(ExclusionReason.NON_LIMITED_BLOCKED);
    }

    @Test
    void upgradableOnlyBlocksGiftsWithoutUpgradePrice() {
        EligibilityEvaluator strict = new EligibilityEvaluator(matcher, true);

        assertThat(strict.evaluate(limited("a", 100, 500, null)).exclusionReason())
                .isEqualTo(ExclusionReason.NON_UPGRADABLE_BLOCKED);
        assertThat(strict.evaluate(limited("b", 100, 500, 25)).eligible()).isTrue();
    }

    @Test
    void eligibleCarriesQuantityAndRecipients() {
        EligibilityVerdict v = new EligibilityEvaluator(matcher, false).evaluate(limited("a", 100, 500, null));

        assertThat(v.eligible()).isTrue();
        assertThat(v.quantity()).isEqualTo(3);
        assertThat(v.recipients()).containsExactly(ALICE);
        assertThat(v.exclusionReason()).isNull();
    }

    @Test
    void rangeMissReportsPriceAndSupply() {
        EligibilityVerdict v = new EligibilityEvaluator(matcher, false).evaluate(limited("a", 100, 20_000, null));

        assertThat(v.exclusionReason()).isEqualTo(ExclusionReason.RANGE_ERROR);
        assertThat(v.price()).isEqualTo(100);
        assertThat(v.totalAmount()).isEqualTo(20_000);
    }
}
