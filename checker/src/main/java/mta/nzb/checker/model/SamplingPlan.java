package mta.nzb.checker.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * SamplingPlan - Segment indices selected for verification.
 * When sampled is false the plan covers every index of the NZB.
 */
public record SamplingPlan(SortedSet<Integer> indices, boolean sampled) {

    public SamplingPlan {
        indices = Collections.unmodifiableSortedSet(new TreeSet<>(indices));
    }

    public int size() {
        return indices.size();
    }
}
