package io.intellixity.strata.services.stats;

public record SystemStats(long projects, long activeProjects, long admins, long activeAdmins) {}
