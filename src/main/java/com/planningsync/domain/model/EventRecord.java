package com.planningsync.domain.model;

import java.util.List;

/**
 * Text fields extracted from one event block.
 */
public record EventRecord(
    String course,
    String room,
    String instructor,
    List<String> groups,
    String notes
) {

    public EventRecord {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
