package com.algoanalytics.unit.reporting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.algoanalytics.reporting.MonthlyReturnsTable;
import com.algoanalytics.returns.ReturnSeries;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MonthlyReturnsTableTest {

    private static ReturnSeries series() {
        return new ReturnSeries(
                List.of(
                        LocalDateTime.of(2024, 1, 10, 16, 0),
                        LocalDateTime.of(2024, 1, 20, 16, 0),
                        LocalDateTime.of(2024, 3, 5, 16, 0)),
                new double[] {0.10, 0.10, -0.05});
    }

    @Test
    @DisplayName("returns within a month are compounded")
    void compounds() {
        MonthlyReturnsTable table = MonthlyReturnsTable.from(series());

        assertThat(table.get(YearMonth.of(2024, 1))).hasValueSatisfying(v -> assertThat(v).isCloseTo(0.21, within(1e-12)));
        assertThat(table.get(YearMonth.of(2024, 3))).hasValueSatisfying(v -> assertThat(v).isCloseTo(-0.05, within(1e-12)));
        assertThat(table.get(YearMonth.of(2024, 2))).isEmpty();
    }

    @Test
    @DisplayName("months without data render as the no-data marker across the whole year")
    void noDataMarker() {
        Map<Integer, Map<String, Object>> map = MonthlyReturnsTable.from(series()).toMap();

        assertThat(map).containsOnlyKeys(2024);
        assertThat(map.get(2024)).hasSize(12);
        assertThat(map.get(2024)).containsEntry("Feb", MonthlyReturnsTable.NO_DATA);
        assertThat(map.get(2024)).containsEntry("Dec", "no data");
        assertThat(map.get(2024).get("Mar")).isInstanceOf(Double.class);
    }

    @Test
    @DisplayName("best and worst month")
    void bestWorst() {
        MonthlyReturnsTable table = MonthlyReturnsTable.from(series());

        assertThat(table.best()).map(Map.Entry::getKey).contains(YearMonth.of(2024, 1));
        assertThat(table.worst()).map(Map.Entry::getKey).contains(YearMonth.of(2024, 3));
    }

    @Test
    @DisplayName("empty series gives an empty table")
    void empty() {
        MonthlyReturnsTable table = MonthlyReturnsTable.from(ReturnSeries.empty());

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.toMap()).isEmpty();
        assertThat(table.best()).isEmpty();
    }
}
