package com.querycache.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabularResultTest {

    @Test
    void fromRecordsKeepsFirstSeenOrderAndInfersTypes() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("id", 1);
        first.put("score", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("id", 2);
        second.put("score", 2.5);
        second.put("label", "b");

        TabularResult result = TabularResult.fromRecords(List.of(first, second));

        assertThat(result.getColumns()).containsExactly(
                TabularColumn.of("id", ColumnType.INTEGER),
                TabularColumn.of("score", ColumnType.FLOAT),
                TabularColumn.of("label", ColumnType.STRING));
        assertThat(result.getRows()).containsExactly(Arrays.asList(1L, 2.0, null), List.of(2L, 2.5, "b"));
    }

    @Test
    void integersBeyondSixtyFourBitsStayExact() {
        TabularResult result = TabularResult.fromRecords(List.of(
                Map.of("id", new BigInteger("12345678901234567890")),
                Map.of("id", 7)));

        assertThat(result.getColumns()).containsExactly(TabularColumn.of("id", ColumnType.STRING));
        assertThat(result.getValue(0, "id")).isEqualTo("12345678901234567890");
        assertThat(result.getValue(1, "id")).isEqualTo("7");
    }

    @Test
    void integerColumnRejectsValuesItCannotHold() {
        assertThatThrownBy(() -> TabularResult.builder()
                .column("id", ColumnType.INTEGER)
                .row(new BigInteger("12345678901234567890"))
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("12345678901234567890");
    }

    @Test
    void rowWidthMustMatchColumns() {
        assertThatThrownBy(() -> TabularResult.builder().column("a", ColumnType.STRING).row("x", "y").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 values");
    }

    @Test
    void dropsPrefixedColumnsAndRenames() {
        TabularResult result = TabularResult.builder()
                .column("ID", ColumnType.INTEGER)
                .column("_ROW", ColumnType.STRING)
                .column("Name", ColumnType.STRING)
                .row(1L, "meta", "a")
                .build();

        TabularResult cleaned = result.withoutColumnsPrefixed("_").withLowerCaseColumns();

        assertThat(cleaned.getColumnNames()).containsExactly("id", "name");
        assertThat(cleaned.getRows()).containsExactly(List.of(1L, "a"));
        assertThat(cleaned.withUpperCaseColumns().getColumnNames()).containsExactly("ID", "NAME");
    }

    @Test
    void valueLookupByColumnName() {
        TabularResult result = TabularResult.builder().column("x", ColumnType.INTEGER).row(3L).build();

        assertThat(result.getValue(0, "x")).isEqualTo(3L);
        assertThat(result.indexOf("y")).isEqualTo(-1);
        assertThatThrownBy(() -> result.getValue(0, "y")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toRecordsPreservesColumnOrder() {
        TabularResult result = TabularResult.builder()
                .column("b", ColumnType.STRING)
                .column("a", ColumnType.INTEGER)
                .row("x", 1L)
                .build();

        assertThat(result.toRecords().get(0).keySet()).containsExactly("b", "a");
    }

    @Test
    void rowsAreImmutable() {
        TabularResult result = TabularResult.builder().column("x", ColumnType.INTEGER).row(1L).build();

        assertThatThrownBy(() -> result.getRows().add(List.of(2L))).isInstanceOf(UnsupportedOperationException.class);
    }
}
