package com.imperium.auditrag.store;

import io.qdrant.client.grpc.Points.Condition;
import io.qdrant.client.grpc.Points.Filter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QdrantFiltersTest {

    @Test
    void emptyOrMissingFilterMeansNoRestriction() {
        assertThat(QdrantFilters.toFilter(null)).isNull();
        assertThat(QdrantFilters.toFilter(Map.of())).isNull();
    }

    @Test
    void everyEntryBecomesOneMustCondition() {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("collection", "journal_entries");
        filter.put("account_id", 4010);
        filter.put("reconciled", true);

        Filter result = QdrantFilters.toFilter(filter);

        assertThat(result.getMustCount()).isEqualTo(3);
        assertThat(result.getShouldCount()).isZero();
        assertThat(result.getMust(0).getField().getKey()).isEqualTo("collection");
        assertThat(result.getMust(0).getField().getMatch().getKeyword()).isEqualTo("journal_entries");
        assertThat(result.getMust(1).getField().getMatch().getInteger()).isEqualTo(4010L);
        assertThat(result.getMust(2).getField().getMatch().getBoolean()).isTrue();
    }

    @Test
    void decimalValuesUseClosedRange() {
        Condition condition = QdrantFilters.toCondition("amount", new BigDecimal("1000.50"));

        assertThat(condition.getField().getKey()).isEqualTo("amount");
        assertThat(condition.getField().getRange().getGte()).isEqualTo(1000.5);
        assertThat(condition.getField().getRange().getLte()).isEqualTo(1000.5);
    }

    @Test
    void otherValuesMatchOnTheirStringForm() {
        Condition condition = QdrantFilters.toCondition("period", java.time.YearMonth.of(2024, 3));

        assertThat(condition.getField().getMatch().getKeyword()).isEqualTo("2024-03");
    }

    @Test
    void nestedValuesAreRejected() {
        assertThatThrownBy(() -> QdrantFilters.toCondition("amount", Map.of("gte", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Filter value for 'amount' must be a scalar");
        assertThatThrownBy(() -> QdrantFilters.toCondition("collection", List.of("payments")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullValueMatchesMissingField() {
        Condition condition = QdrantFilters.toCondition("approved_by", null);

        assertThat(condition.getIsNull().getKey()).isEqualTo("approved_by");
    }
}
