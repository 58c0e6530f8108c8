package com.giftsbuyer.domain.gift;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GiftCatalogTest {

    private static Gift gift(String id, int price) {
        return new Gift(id, price, true, false, 100, 100, null);
    }

    @Test
    void keepsPlatformOrder() {
        GiftCatalog c = GiftCatalog.of(List.of(gift("b", 1), gift("a", 2), gift("c", 3)));

        assertThat(c.discoveryOrder()).containsExactly("b", "a", "c");
        assertThat(c.find("a")).map(Gift::price).contains(2);
    }

    @Test
    void diffIsByIdOnly() {
        GiftCatalog known = GiftCatalog.of(List.of(gift("a", 1)));
        GiftCatalog current = GiftCatalog.of(List.of(gift("a", 999), gift("b", 2)));

        assertThat(current.newSince(known)).containsOnlyKeys("b");
        assertThat(current.newSince(current)).isEmpty();
    }

    @Test
    void everythingIsNewAgainstAnEmptySnapshot() {
        GiftCatalog current = GiftCatalog.of(List.of(gift("a", 1), gift("b", 2)));

        assertThat(current.newSince(GiftCatalog.empty()).keySet()).containsExactly("a", "b");
        assertThat(current.newSince(null)).hasSize(2);
    }
}
