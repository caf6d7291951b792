package com.nevis.corpus.model;

import java.time.OffsetDateTime;
import java.util.List;

public record StepOutcome<T>(
    List<T> result,
    OffsetDateTime doneAt
) {
    public StepOutcome {
        result = List.copyOf(result);
    }
}
