package com.warehouseledger.service;

import com.warehouseledger.dto.CaseRecordRequest;
import com.warehouseledger.dto.LeadTimeResponse;
import com.warehouseledger.model.CaseTimeline;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.warehouseledger.service.LedgerFixtures.SITE_DAS;
import static com.warehouseledger.service.LedgerFixtures.SITE_MIR;
import static com.warehouseledger.service.LedgerFixtures.WH_A;
import static com.warehouseledger.service.LedgerFixtures.WH_B;
import static com.warehouseledger.service.LedgerFixtures.at;
import static com.warehouseledger.service.LedgerFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

class LeadTimeAnalyzerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-31T00:00:00Z"), ZoneOffset.UTC);

    private final LocationClassifier classifier = LedgerFixtures.classifier();
    private final CaseTimelineBuilder builder = new CaseTimelineBuilder(classifier);
    private final LeadTimeAnalyzer analyzer = new LeadTimeAnalyzer(classifier, CLOCK);

    private List<CaseTimeline> timelines(CaseRecordRequest... records) {
        return builder.buildAll(List.of(records)).timelines();
    }

    @Test
    void leadTime_spansFirstWarehouseToLastSite() {
        var timeline = timelines(record("C1",
            at(WH_B, "2024-01-01"), at(WH_A, "2024-01-20"), at(SITE_DAS, "2024-02-01"), at(SITE_MIR, "2024-03-01")))
            .get(0);

        var leadTime = analyzer.leadTime(timeline).orElseThrow();

        assertThat(leadTime.getInitialWarehouse()).isEqualTo(WH_B);
        assertThat(leadTime.getFinalSite()).isEqualTo(SITE_MIR);
        assertThat(leadTime.getLeadTimeDays()).isEqualTo(60);
    }

    @Test
    void casesWithoutWarehouseOrSite_areLeftOut() {
        var cases = timelines(
            record("SITE_ONLY", at(SITE_DAS, "2024-02-01")),
            record("STILL_STORED", at(WH_A, "2024-02-01")));

        var response = analyzer.analyze(cases, 30);

        assertThat(response.getOverall().getCount()).isZero();
        assertThat(response.getByInitialWarehouse()).isEmpty();
        assertThat(response.getLongLeadTimeCases()).isEmpty();
    }

    @Test
    void analyze_groupsAndRanksLongLeadTimes() {
        var cases = timelines(
            record("C1", at(WH_A, "2024-01-01"), at(SITE_DAS, "2024-01-11")),
            record("C2", at(WH_A, "2024-01-01"), at(SITE_DAS, "2024-03-01")),
            record("C3", at(WH_B, "2024-01-01"), at(SITE_MIR, "2024-03-01")));

        var response = analyzer.analyze(cases, 30);

        assertThat(response.getGeneratedAt()).isEqualTo(Instant.parse("2024-12-31T00:00:00Z"));
        assertThat(response.getOverall().getCount()).isEqualTo(3);
        assertThat(response.getOverall().getMinDays()).isEqualTo(10);
        assertThat(response.getOverall().getMaxDays()).isEqualTo(60);
        assertThat(response.getByInitialWarehouse()).extracting(LeadTimeResponse.GroupStatistics::getGroup)
            .containsExactly(WH_A, WH_B);
        assertThat(response.getByInitialWarehouse().get(0).getLeadTime().getMeanDays()).isEqualTo(35.0);
        assertThat(response.getByCategory()).extracting(LeadTimeResponse.GroupStatistics::getGroup)
            .containsExactly("Electrical");
        assertThat(response.getLongLeadTimeCases()).extracting(LeadTimeResponse.CaseLeadTime::getCaseId)
            .containsExactly("C2", "C3");
    }
}
