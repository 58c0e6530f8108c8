package com.giftsbuyer.domain.gift;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Id-keyed view over one full catalog fetch (or a loaded snapshot).
 * Keeps the platform-provided order as the discovery order.
 */
public final class GiftCatalog {

    private static final GiftCatalog EMPTY = new GiftCatalog(new LinkedHashMap<>());

    private final Map<String, Gift> byId;

    private GiftCatalog(LinkedHashMap<String, Gift> byId) {
        this.byId = Collections.unmodifiableMap(byId);
    }

    public static GiftCatalog empty() {
        return EMPTY;
    }

    /** Later duplicates of the same id replace earlier ones but keep the first position. */
    public static GiftCatalog of(Collection<Gift> gifts) {
        LinkedHashMap<String, Gift> map = new LinkedHashMap<>();
        if (gifts != null) {
            for (Gift g : gifts) {
                if (g != null) map.put(g.id(), g);
            }
        }
        return new GiftCatalog(map);
    }

    public Map<String, Gift> byId() {
        return byId;
    }

    public List<String> discoveryOrder() {
        return List.copyOf(byId.keySet());
    }

    public List<Gift> gifts() {
        return new ArrayList<>(byId.values());
    }

    public Optional<Gift> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    /**
     * Gifts present here but absent from {@code known}.
     * Comparison is by id only: a known gift with changed attributes is not new.
     */
    public Map<String, Gift> newSince(GiftCatalog known) {
        GiftCatalog base = (known == null) ? EMPTY : known;
        Map<String, Gift> fresh = new LinkedHashMap<>();
        for (Map.Entry<String, Gift> e : byId.entrySet()) {
            if (!base.contains(e.getKey())) fresh.put(e.getKey(), e.getValue());
        }
        return fresh;
    }
}
