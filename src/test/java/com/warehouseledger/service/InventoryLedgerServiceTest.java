package com.warehouseledger.service;

import com.warehouseledger.config.LedgerProperties;
import com.warehouseledger.dto.CaseFilterRequest;
import com.warehouseledger.dto.DeadStockRecord;
import com.warehouseledger.dto.ExcludedCase;
import com.warehouseledger.dto.LedgerReportResponse;
import com.warehouseledger.dto.LedgerRunRequest;
import com.warehouseledger.exception.AnalysisInputException;
import com.warehouseledger.exception.BatchSizeExceededException;
import com.warehouseledger.model.ExclusionReason;
import com.warehouseledger.model.LocationKind;
import com.warehouseledger.model.MovementStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static com.warehouseledger.service.LedgerFixtures.SITE_DAS;
import static com.warehouseledger.service.LedgerFixtures.WH_A;
import static com.warehouseledger.service.LedgerFixtures.WH_B;
import static com.warehouseledger.service.LedgerFixtures.at;
import static com.warehouseledger.service.LedgerFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class InventoryLedgerServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T08:00:00Z"), ZoneOffset.UTC);

    @Mock
    CaseTimelineBuilder mockBuilder;

    private LedgerProperties properties;
    private InventoryLedgerService ledgerService;

    @BeforeEach
    void setUp() {
        properties = LedgerFixtures.properties();
        properties.setMaxCasesPerRun(10);
        ledgerService = service(new CaseTimelineBuilder(LedgerFixtures.classifier()));
    }

    private InventoryLedgerService service(CaseTimelineBuilder builder) {
        LocationClassifier classifier = new LocationClassifier(properties);
        return new InventoryLedgerService(
            builder,
            new MonthlyAggregator(classifier),
            new DeadStockDetector(classifier),
            new CaseFilter(classifier),
            new LeadTimeAnalyzer(classifier, CLOCK),
            classifier,
            properties,
            CLOCK);
    }

    private LedgerRunRequest sampleRun() {
        return LedgerRunRequest.builder()
            .cases(List.of(
                record("X", at(WH_A, "2025-01-10"), at(WH_B, "2025-03-02")),
                record("Y", at(SITE_DAS, "2025-02-15")),
                record("Z", at(WH_A, "2025-01-01")),
                record("EMPTY", at(WH_A, null))))
            .build();
    }

    @Test
    void report_usesClockForDefaultReferenceDateAndConfiguredThresholds() {
        var response = ledgerService.report(sampleRun(), "req-1");

        assertThat(response.getReferenceDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(response.getGeneratedAt()).isEqualTo(Instant.parse("2025-06-01T08:00:00Z"));
        assertThat(response.getTotalCases()).isEqualTo(4);
        assertThat(response.getIncludedCases()).isEqualTo(3);
        assertThat(response.getExcludedCases()).isEqualTo(1);
        assertThat(response.getExclusions()).extracting(ExcludedCase::getReason)
            .containsExactly(ExclusionReason.EMPTY_TIMELINE);
        assertThat(response.getDeadStock()).extracting(DeadStockRecord::getCaseId).containsExactly("Z", "X");
        assertThat(response.getSummary().getFlaggedDeadStock()).isEqualTo(2);
    }

    @Test
    void report_summaryCarriesFinalMonthTotals() {
        var response = ledgerService.report(sampleRun(), "req-2");

        assertThat(response.getSummary().getWarehouseEndingStock())
            .extracting(LedgerReportResponse.LocationTotal::getLocationId, LedgerReportResponse.LocationTotal::getCount)
            .containsExactly(
                tuple(WH_A, 1),
                tuple(WH_B, 1));
        assertThat(response.getSummary().getSiteCumulativeInbound())
            .extracting(LedgerReportResponse.LocationTotal::getCount)
            .containsExactly(1);
    }

    @Test
    void report_appliesFilterBeforeCounting() {
        var run = LedgerRunRequest.builder()
            .cases(sampleRun().getCases())
            .referenceDate(LocalDate.of(2025, 2, 1))
            .thresholds(List.of(30))
            .filter(CaseFilterRequest.builder().movementStatus(MovementStatus.IN_STOCK).build())
            .build();

        var response = ledgerService.report(run, "req-3");

        assertThat(response.getMatchedCases()).isEqualTo(2);
        assertThat(response.getDeadStock()).extracting(DeadStockRecord::getCaseId).containsExactly("Z", "X");
        assertThat(response.getDeadStock().get(0).getThresholdDays()).isEqualTo(30);
        assertThat(response.getDeadStock().get(1).isFlagged()).isFalse();
    }

    @Test
    void deadStock_reportsUrgentCasesAndBuckets() {
        var run = LedgerRunRequest.builder()
            .cases(List.of(
                record("OLD", at(WH_B, "2024-01-01")),
                record("NEW", at(WH_A, "2025-05-01"))))
            .build();

        var response = ledgerService.deadStock(run);

        assertThat(response.getInStockCases()).isEqualTo(2);
        assertThat(response.getFlaggedCases()).isEqualTo(1);
        assertThat(response.getUrgentThresholdDays()).isEqualTo(365);
        assertThat(response.getUrgentCases()).extracting(DeadStockRecord::getCaseId).containsExactly("OLD");
        assertThat(response.getThresholds()).containsExactly(90, 180, 365);
    }

    @Test
    void timelines_reportCurrentLocationAsOfGivenDate() {
        var response = ledgerService.timelines(sampleRun().getCases(), LocalDate.of(2025, 2, 1));

        assertThat(response.getCaseCount()).isEqualTo(3);
        var x = response.getTimelines().get(0);
        assertThat(x.getCaseId()).isEqualTo("X");
        assertThat(x.getCurrentLocation()).isEqualTo(WH_A);
        assertThat(x.getCurrentLocationKind()).isEqualTo(LocationKind.WAREHOUSE);
        assertThat(x.getMovementStatus()).isEqualTo(MovementStatus.IN_STOCK);
        assertThat(response.getTimelines().get(1).getMovementStatus()).isEqualTo(MovementStatus.NOT_RECEIVED);
    }

    @Test
    void leadTimes_rejectNegativeThreshold() {
        assertThatThrownBy(() -> ledgerService.leadTimes(sampleRun(), -1))
            .isInstanceOf(AnalysisInputException.class);
    }

    @Test
    void leadTimes_stampTheInjectedClock() {
        var response = ledgerService.leadTimes(sampleRun(), 30);

        assertThat(response.getGeneratedAt()).isEqualTo(Instant.parse("2025-06-01T08:00:00Z"));
        assertThat(response.getExclusions()).extracting(ExcludedCase::getCaseId).containsExactly("EMPTY");
    }

    @Test
    void locations_listWarehousesThenSitesWithRanks() {
        var response = ledgerService.locations();

        assertThat(response.getWarehouses()).hasSize(3);
        assertThat(response.getSites()).hasSize(2);
        assertThat(response.getSites().get(0).getRank()).isEqualTo(3);
    }

    @Test
    void oversizedBatch_isRejectedBeforeBuildingTimelines() {
        var guarded = service(mockBuilder);
        var run = LedgerRunRequest.builder()
            .cases(Collections.nCopies(11, record("DUP", at(WH_A, "2025-01-01"))))
            .build();

        assertThatThrownBy(() -> guarded.report(run, "req-4"))
            .isInstanceOf(BatchSizeExceededException.class);
        verify(mockBuilder, never()).buildAll(any());
    }
}
