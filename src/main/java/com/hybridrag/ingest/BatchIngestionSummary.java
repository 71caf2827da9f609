package com.hybridrag.ingest;

import java.util.List;
import java.util.Map;

public record BatchIngestionSummary(int succeeded, int failed, int chunks, List<IngestionReport> reports, Map<String, String> failures) {
    public static BatchIngestionSummary of(List<IngestionReport> reports, Map<String, String> failures) {
        int chunks = reports.stream().mapToInt(IngestionReport::chunksCreated).sum();
        return new BatchIngestionSummary(reports.size(), failures.size(), chunks, List.copyOf(reports), Map.copyOf(failures));
    }
}
