package com.waterfront.listings.crawl.persistence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped set of listing ids already stored. It only grows while a run is active and is safe
 * to share between crawl and extraction workers.
 */
public class DedupIndex {
    private final Set<String> zpids = ConcurrentHashMap.newKeySet();

    public DedupIndex() {
    }

    public DedupIndex(Collection<String> initial) {
        if (initial != null) {
            for (String zpid : initial) {
                add(zpid);
            }
        }
    }

    public boolean contains(String zpid) {
        return zpid != null && zpids.contains(zpid);
    }

    /**
     * @return true when the id was not indexed before
     */
    public boolean add(String zpid) {
        if (zpid == null || zpid.isBlank()) {
            return false;
        }
        return zpids.add(zpid.trim());
    }

    public int size() {
        return zpids.size();
    }

    public List<String> snapshot() {
        List<String> copy = new ArrayList<>(zpids);
        Collections.sort(copy);
        return copy;
    }
}
