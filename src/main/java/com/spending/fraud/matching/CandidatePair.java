package com.spending.fraud.matching;

import com.spending.fraud.core.model.EntityRef;

import java.util.Comparator;
import java.util.Objects;

/**
 * A pair of entities whose names scored at or above the matching threshold.
 * In self-matching {@code first} is the canonically lower entity; in cross-matching
 * {@code first} comes from the probed collection and {@code second} from the reference.
 */
public record CandidatePair(EntityRef first, EntityRef second, double score) implements Comparable<CandidatePair> {

    private static final Comparator<CandidatePair> ORDER = Comparator
            .comparing(CandidatePair::first)
            .thenComparing(CandidatePair::second);

    public CandidatePair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
    }

    public boolean isExact() {
        return score == 1.0;
    }

    @Override
    public int compareTo(CandidatePair other) {
        return ORDER.compare(this, other);
    }
}
