package mta.nzb.checker.service.sampling;

import mta.nzb.checker.model.SamplingPlan;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * SamplingPlanner
 * Chooses which segment indices of an NZB to verify under a probe budget.
 * The first and last segments are always included because truncated or
 * incomplete uploads show up there; the interior is drawn at random.
 */
@Component
public class SamplingPlanner {

    /**
     * Number of leading and trailing indices reserved on each edge.
     */
    public static final int EDGE_SLOTS = 1;

    /**
     * Plans which segments to check.
     *
     * @param total  number of segments in the NZB
     * @param budget maximum number of segments to check; zero or less means no limit
     * @param rng    random source for interior picks, supplied per call
     * @return every index when total fits the budget, otherwise exactly budget distinct indices
     */
    public SamplingPlan plan(int total, int budget, Random rng) {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative: " + total);
        }
        if (budget <= 0 || total <= budget) {
            SortedSet<Integer> all = new TreeSet<>();
            for (int i = 0; i < total; i++) {
                all.add(i);
            }
            return new SamplingPlan(all, false);
        }

        SortedSet<Integer> selected = new TreeSet<>();

        // Edges first. A budget too small for both edges keeps the leading one.
        int leading = Math.min(EDGE_SLOTS, budget - budget / 2);
        int trailing = Math.min(EDGE_SLOTS, budget - leading);
        for (int i = 0; i < leading; i++) {
            selected.add(i);
        }
        for (int i = total - trailing; i < total; i++) {
            selected.add(i);
        }

        int interiorStart = leading;
        int interiorEnd = total - trailing;
        int needed = budget - selected.size();
        selected.addAll(drawDistinct(interiorStart, interiorEnd, needed, rng));

        return new SamplingPlan(selected, true);
    }

    /**
     * Floyd's algorithm: count distinct values from [from, to) without materialising the range.
     */
    static Set<Integer> drawDistinct(int from, int to, int count, Random rng) {
        int range = to - from;
        if (count <= 0 || range <= 0) {
            return Set.of();
        }
        if (count > range) {
            throw new IllegalArgumentException("cannot draw " + count + " distinct values from " + range);
        }
        Set<Integer> picked = new HashSet<>(count * 2);
        for (int j = range - count; j < range; j++) {
            int candidate = rng.nextInt(j + 1);
            if (!picked.add(from + candidate)) {
                picked.add(from + j);
            }
        }
        return picked;
    }
}
