package com.giftsbuyer.application.ports;

import com.giftsbuyer.domain.gift.Gift;
import com.giftsbuyer.domain.gift.GiftCatalog;

import java.util.List;

/**
 * Persistence of the last-seen catalog.
 *
 * - load(): a missing store is an empty catalog (first run), not an error.
 * - save(): replaces the whole snapshot; implementations must make the replace atomic.
 */
public interface SnapshotStorePort {

    GiftCatalog load();

    void save(List<Gift> gifts);
}
