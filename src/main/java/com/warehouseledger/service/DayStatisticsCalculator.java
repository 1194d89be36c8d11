package com.warehouseledger.service;

import com.warehouseledger.dto.DayStatistics;

import java.util.List;

final class DayStatisticsCalculator {

    private DayStatisticsCalculator() {
    }

    static DayStatistics of(List<Long> days) {
        if (days == null || days.isEmpty()) {
            return DayStatistics.builder().count(0).build();
        }
        List<Long> sorted = days.stream().sorted().toList();
        int n = sorted.size();
        double mean = sorted.stream().mapToLong(Long::longValue).average().orElse(0.0);
        double median = n % 2 == 1
            ? sorted.get(n / 2)
            : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
        return DayStatistics.builder()
            .count(n)
            .meanDays(round(mean))
            .medianDays(round(median))
            .minDays(sorted.get(0))
            .maxDays(sorted.get(n - 1))
            .build();
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
