package mta.nzb.checker.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ParsedNzb - Segment list and file metadata extracted from an NZB document.
 * segmentIds are unique, bracketed message-ids in file order then segment order.
 */
public record ParsedNzb(
    List<String> segmentIds,
    boolean hasArchiveHint,
    Set<String> subjects,
    Set<String> groups
) {

    public ParsedNzb {
        segmentIds = List.copyOf(segmentIds);
        subjects = Collections.unmodifiableSet(new LinkedHashSet<>(subjects));
        groups = Collections.unmodifiableSet(new LinkedHashSet<>(groups));
    }

    public int totalSegments() {
        return segmentIds.size();
    }
}
