package com.warehouseledger.service;

import com.warehouseledger.dto.MonthlyLedger;
import com.warehouseledger.exception.LedgerConsistencyException;
import com.warehouseledger.model.CaseTimeline;
import com.warehouseledger.model.LocationEvent;
import com.warehouseledger.model.WarehouseClass;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class MonthlyAggregator {

    private final LocationClassifier classifier;

    public MonthlyLedger aggregate(List<CaseTimeline> timelines) {
        return aggregate(timelines, null);
    }

    public MonthlyLedger aggregate(List<CaseTimeline> timelines, YearMonth throughMonth) {
        Map<String, Map<YearMonth, Flow>> warehouseFlows = new HashMap<>();
        Map<String, Map<YearMonth, Integer>> siteInbound = new HashMap<>();
        YearMonth first = null;
        YearMonth last = null;
        boolean capped = false;

        for (CaseTimeline timeline : timelines) {
            LocationEvent previous = null;
            for (LocationEvent event : timeline.getEvents()) {
                YearMonth month = event.month();
                if (throughMonth != null && month.isAfter(throughMonth)) {
                    capped = true;
                    break;
                }
                // the Out for a warehouse lands in the month the case arrives at its next location
                if (previous != null && previous.isWarehouse()) {
                    flow(warehouseFlows, previous.locationId(), month).outbound++;
                }
                if (event.isWarehouse()) {
                    flow(warehouseFlows, event.locationId(), month).inbound++;
                } else {
                    siteInbound.computeIfAbsent(event.locationId(), k -> new HashMap<>())
                        .merge(month, 1, Integer::sum);
                }
                first = first == null || month.isBefore(first) ? month : first;
                last = last == null || month.isAfter(last) ? month : last;
                previous = event;
            }
        }

        if (first == null) {
            return MonthlyLedger.empty();
        }
        if (capped) {
            // later arrivals exist, so the quiet months up to the cap are still reported
            last = throughMonth;
        }

        List<YearMonth> months = monthRange(first, last);
        List<MonthlyLedger.WarehouseRow> warehouseRows = warehouseRows(months, warehouseFlows);
        List<MonthlyLedger.SiteRow> siteRows = siteRows(months, siteInbound);

        return MonthlyLedger.builder()
            .firstMonth(first)
            .lastMonth(last)
            .warehouseMonthly(warehouseRows)
            .classificationMonthly(classificationRows(months, warehouseRows))
            .siteMonthly(siteRows)
            .build();
    }

    public int endingStockSnapshot(List<CaseTimeline> timelines, String warehouseId, YearMonth month) {
        LocalDate endOfMonth = month.atEndOfMonth();
        return (int) timelines.stream()
            .map(t -> t.currentLocation(endOfMonth))
            .filter(location -> location.isPresent() && location.get().equals(warehouseId))
            .count();
    }

    public void verifyConsistency(MonthlyLedger ledger, List<CaseTimeline> timelines) {
        Map<YearMonth, Map<String, Integer>> snapshots = new HashMap<>();
        for (MonthlyLedger.WarehouseRow row : ledger.getWarehouseMonthly()) {
            Map<String, Integer> residents = snapshots.computeIfAbsent(row.getMonth(),
                month -> residentsAt(timelines, month.atEndOfMonth()));
            int snapshot = residents.getOrDefault(row.getWarehouseId(), 0);
            if (snapshot != row.getEndingStock()) {
                throw new LedgerConsistencyException(String.format(
                    "Ending stock mismatch for %s in %s: running balance=%d, snapshot=%d",
                    row.getWarehouseId(), row.getMonth(), row.getEndingStock(), snapshot));
            }
        }
        log.debug("Ledger consistency verified | rows={}", ledger.getWarehouseMonthly().size());
    }

    private Map<String, Integer> residentsAt(List<CaseTimeline> timelines, LocalDate date) {
        Map<String, Integer> residents = new HashMap<>();
        for (CaseTimeline timeline : timelines) {
            timeline.currentEvent(date)
                .filter(LocationEvent::isWarehouse)
                .ifPresent(e -> residents.merge(e.locationId(), 1, Integer::sum));
        }
        return residents;
    }

    private List<MonthlyLedger.WarehouseRow> warehouseRows(
            List<YearMonth> months, Map<String, Map<YearMonth, Flow>> flows) {
        List<String> warehouses = classifier.warehouseIds().stream()
            .filter(flows::containsKey)
            .toList();
        Map<String, Integer> stock = new HashMap<>();
        List<MonthlyLedger.WarehouseRow> rows = new ArrayList<>();

        for (YearMonth month : months) {
            for (String warehouse : warehouses) {
                Flow flow = flows.get(warehouse).getOrDefault(month, Flow.NONE);
                int ending = stock.getOrDefault(warehouse, 0) + flow.inbound - flow.outbound;
                stock.put(warehouse, ending);
                rows.add(MonthlyLedger.WarehouseRow.builder()
                    .warehouseId(warehouse)
                    .classification(classifier.classification(warehouse))
                    .month(month)
                    .inbound(flow.inbound)
                    .outbound(flow.outbound)
                    .endingStock(ending)
                    .build());
            }
        }
        return rows;
    }

    private List<MonthlyLedger.ClassificationRow> classificationRows(
            List<YearMonth> months, List<MonthlyLedger.WarehouseRow> warehouseRows) {
        Map<YearMonth, Map<WarehouseClass, int[]>> totals = new HashMap<>();
        for (MonthlyLedger.WarehouseRow row : warehouseRows) {
            int[] sums = totals.computeIfAbsent(row.getMonth(), m -> new EnumMap<>(WarehouseClass.class))
                .computeIfAbsent(row.getClassification(), c -> new int[3]);
            sums[0] += row.getInbound();
            sums[1] += row.getOutbound();
            sums[2] += row.getEndingStock();
        }

        List<MonthlyLedger.ClassificationRow> rows = new ArrayList<>();
        for (YearMonth month : months) {
            Map<WarehouseClass, int[]> byClass = totals.get(month);
            if (byClass == null) {
                continue;
            }
            byClass.forEach((classification, sums) -> rows.add(MonthlyLedger.ClassificationRow.builder()
                .classification(classification)
                .month(month)
                .inbound(sums[0])
                .outbound(sums[1])
                .endingStock(sums[2])
                .build()));
        }
        return rows;
    }

    private List<MonthlyLedger.SiteRow> siteRows(
            List<YearMonth> months, Map<String, Map<YearMonth, Integer>> inbound) {
        List<String> sites = classifier.siteIds().stream()
            .filter(inbound::containsKey)
            .toList();
        Map<String, Integer> cumulative = new HashMap<>();
        List<MonthlyLedger.SiteRow> rows = new ArrayList<>();

        for (YearMonth month : months) {
            for (String site : sites) {
                int arrivals = inbound.get(site).getOrDefault(month, 0);
                int total = cumulative.getOrDefault(site, 0) + arrivals;
                cumulative.put(site, total);
                rows.add(MonthlyLedger.SiteRow.builder()
                    .siteId(site)
                    .siteGroup(classifier.group(site))
                    .month(month)
                    .inbound(arrivals)
                    .cumulativeInbound(total)
                    .build());
            }
        }
        return rows;
    }

    private static Flow flow(Map<String, Map<YearMonth, Flow>> flows, String warehouse, YearMonth month) {
        return flows.computeIfAbsent(warehouse, k -> new HashMap<>()).computeIfAbsent(month, m -> new Flow());
    }

    private static List<YearMonth> monthRange(YearMonth first, YearMonth last) {
        List<YearMonth> months = new ArrayList<>();
        for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
            months.add(month);
        }
        return months;
    }

    private static final class Flow {
        private static final Flow NONE = new Flow();
        private int inbound;
        private int outbound;
    }
}
