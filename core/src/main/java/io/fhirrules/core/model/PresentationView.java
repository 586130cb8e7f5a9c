package io.fhirrules.core.model;

import java.util.List;

/**
 * Display transform of a finding list: groups of two or more plus the
 * remaining single findings. Never used for counting.
 */
public record PresentationView(List<FindingGroup> groups, List<Finding> ungrouped) {

    public PresentationView {
        groups = List.copyOf(groups);
        ungrouped = List.copyOf(ungrouped);
    }
}
