package com.spending.fraud.matching;

import com.spending.fraud.core.model.EntityRef;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup from blocking key and exact normalized name to index-side entities.
 * Built once by the coordinator and shared read-only by all matching workers.
 */
final class BlockIndex {

    /**
     * An entity prepared for matching.
     */
    record Entry(EntityRef ref, String name, Set<String> keys) {
    }

    private static final Comparator<Entry> BY_REF = Comparator.comparing(Entry::ref);

    private final Map<String, List<Entry>> buckets;
    private final Map<String, List<Entry>> byName;
    private final int oversizedBlocks;

    private BlockIndex(Map<String, List<Entry>> buckets, Map<String, List<Entry>> byName, int oversizedBlocks) {
        this.buckets = buckets;
        this.byName = byName;
        this.oversizedBlocks = oversizedBlocks;
    }

    static BlockIndex build(List<Entry> entries, int maxBlockSize) {
        Map<String, List<Entry>> buckets = new HashMap<>();
        Map<String, List<Entry>> byName = new HashMap<>();
        for (Entry entry : entries) {
            for (String key : entry.keys()) {
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
            }
            byName.computeIfAbsent(entry.name(), k -> new ArrayList<>()).add(entry);
        }

        int oversized = 0;
        Iterator<Map.Entry<String, List<Entry>>> it = buckets.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, List<Entry>> bucket = it.next();
            if (bucket.getValue().size() > maxBlockSize) {
                it.remove();
                oversized++;
            } else {
                bucket.getValue().sort(BY_REF);
                bucket.setValue(List.copyOf(bucket.getValue()));
            }
        }
        byName.replaceAll((name, list) -> {
            list.sort(BY_REF);
            return List.copyOf(list);
        });
        return new BlockIndex(Map.copyOf(buckets), Map.copyOf(byName), oversized);
    }

    List<Entry> bucket(String key) {
        return buckets.getOrDefault(key, List.of());
    }

    List<Entry> exact(String name) {
        return byName.getOrDefault(name, List.of());
    }

    int oversizedBlocks() {
        return oversizedBlocks;
    }
}
