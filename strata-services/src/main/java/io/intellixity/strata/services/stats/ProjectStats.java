package io.intellixity.strata.services.stats;

/** Per-project counters; the first three come from the project database, the rest from main. */
public record ProjectStats(String projectId,
                           long collections,
                           long documents,
                           long files,
                           long storageUsed,
                           long apiCalls,
                           String lastApiCall) {}
