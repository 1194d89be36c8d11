package com.warehouseledger.service;

import com.warehouseledger.dto.CaseFilterRequest;
import com.warehouseledger.dto.CaseRecordRequest;
import com.warehouseledger.exception.UnknownLocationException;
import com.warehouseledger.model.CaseTimeline;
import com.warehouseledger.model.MovementStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.warehouseledger.service.LedgerFixtures.SITE_DAS;
import static com.warehouseledger.service.LedgerFixtures.SITE_MIR;
import static com.warehouseledger.service.LedgerFixtures.WH_A;
import static com.warehouseledger.service.LedgerFixtures.WH_B;
import static com.warehouseledger.service.LedgerFixtures.at;
import static com.warehouseledger.service.LedgerFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaseFilterTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 30);

    private final LocationClassifier classifier = LedgerFixtures.classifier();
    private final CaseTimelineBuilder builder = new CaseTimelineBuilder(classifier);
    private final MonthlyAggregator aggregator = new MonthlyAggregator(classifier);
    private final CaseFilter filter = new CaseFilter(classifier);

    private final List<CaseTimeline> population = builder.buildAll(List.of(
        record("C1", at(WH_A, "2024-01-10"), at(SITE_DAS, "2024-03-01")),
        record("C2", at(WH_B, "2024-02-10")),
        CaseRecordRequest.builder()
            .caseId("C3")
            .supplier("siemens")
            .category("Mechanical")
            .storageType("Outdoor")
            .status("Closed")
            .arrival(at(WH_A, "2024-02-01"))
            .arrival(at(WH_B, "2024-04-01"))
            .arrival(at(SITE_MIR, "2024-08-01"))
            .build())).timelines();

    @Test
    void emptyFilter_keepsEveryCase() {
        assertThat(filter.apply(population, null, AS_OF)).isSameAs(population);
        assertThat(filter.apply(population, CaseFilterRequest.builder().build(), AS_OF)).isSameAs(population);
    }

    @Test
    void attributeMatching_isCaseInsensitiveAndAnded() {
        var request = CaseFilterRequest.builder().supplier("SIEMENS").storageType("outdoor").build();

        assertThat(filter.apply(population, request, AS_OF)).extracting(CaseTimeline::getCaseId).containsExactly("C3");

        var contradictory = CaseFilterRequest.builder().supplier("SIEMENS").category("Electrical").build();
        assertThat(filter.apply(population, contradictory, AS_OF)).isEmpty();
    }

    @Test
    void locationFilters_matchAnyVisitInTheTimeline() {
        var viaWarehouseA = CaseFilterRequest.builder().warehouse(WH_A).build();
        var toMirfa = CaseFilterRequest.builder().site(SITE_MIR).build();

        assertThat(filter.apply(population, viaWarehouseA, AS_OF)).extracting(CaseTimeline::getCaseId)
            .containsExactly("C1", "C3");
        assertThat(filter.apply(population, toMirfa, AS_OF)).extracting(CaseTimeline::getCaseId)
            .containsExactly("C3");
    }

    @Test
    void movementStatus_isEvaluatedAtTheGivenDate() {
        var inStock = CaseFilterRequest.builder().movementStatus(MovementStatus.IN_STOCK).build();

        assertThat(filter.apply(population, inStock, AS_OF)).extracting(CaseTimeline::getCaseId)
            .containsExactly("C2", "C3");
        assertThat(filter.apply(population, inStock, LocalDate.of(2024, 12, 31))).extracting(CaseTimeline::getCaseId)
            .containsExactly("C2");
        assertThat(population.get(0).movementStatus(LocalDate.of(2023, 12, 31))).isEqualTo(MovementStatus.NOT_RECEIVED);
    }

    @Test
    void filteredLedger_equalsLedgerOfTheMatchingSubset() {
        var request = CaseFilterRequest.builder().warehouse(WH_B).build();
        var subset = population.stream().filter(t -> t.visited(WH_B)).toList();

        assertThat(aggregator.aggregate(filter.apply(population, request, AS_OF)))
            .isEqualTo(aggregator.aggregate(subset));
    }

    @Test
    void unknownLocationInFilter_isRejected() {
        var request = CaseFilterRequest.builder().warehouse(SITE_DAS).build();

        assertThatThrownBy(() -> filter.apply(population, request, AS_OF))
            .isInstanceOf(UnknownLocationException.class)
            .hasMessageContaining("warehouse");
    }
}
