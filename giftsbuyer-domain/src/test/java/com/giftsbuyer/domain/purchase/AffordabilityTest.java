package com.giftsbuyer.domain.purchase;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AffordabilityTest {

    @Test
    void limitedByBalance() {
        Affordability a = Affordability.compute(5, 10, 25);

        assertThat(a.affordable()).isEqualTo(2);
        assertThat(a.partial()).isTrue();
        assertThat(a.shortfallUnits()).isEqualTo(3);
        assertThat(a.shortfallCost()).isEqualTo(30);
    }

    @Test
    void nothingAffordable() {
        Affordability a = Affordability.compute(3, 10, 5);

        assertThat(a.none()).isTrue();
        assertThat(a.requestedCost()).isEqualTo(30);
    }

    @Test
    void unknownPriceIsTreatedAsFree() {
        Affordability a = Affordability.compute(4, 0, 0);

        assertThat(a.affordable()).isEqualTo(4);
        assertThat(a.partial()).isFalse();
    }

    @Test
    void neverMoreThanRequested() {
        assertThat(Affordability.compute(2, 10, 1_000_000).affordable()).isEqualTo(2);
        assertThat(Affordability.compute(2, 10, -50).affordable()).isZero();
    }
}
