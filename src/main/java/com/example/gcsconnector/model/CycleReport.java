package com.example.gcsconnector.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record CycleReport(Map<Path, UploadOutcome> outcomes, List<String> uploadedNames, boolean manifestPublished) {

    public long count(UploadOutcome outcome) {
        return outcomes.values().stream().filter(outcome::equals).count();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }
}
