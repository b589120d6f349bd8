package com.poolintelligence.common.tracker;

public record TvlTrackerStats(int trackedPools, int totalSnapshots, long oldestSnapshotAgeMinutes) {}
