package io.github.yok.danp.core.danp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.danp.core.error.EmptyGroupException;
import io.github.yok.danp.core.error.InvalidInputException;
import io.github.yok.danp.testutil.DanpFixtures;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("次元グルーピング")
class DimensionGroupingTest {

    private static final List<String> LABELS = List.of("a", "b", "c", "d");

    @Test
    @DisplayName("指定順の次元と、元のラベル順の指標添字を持つ")
    void keepsDimensionOrderAndIndicatorOrder() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        groups.put("Y", List.of("d", "b"));
        groups.put("X", List.of("c", "a"));

        DimensionGrouping grouping = DimensionGrouping.of(groups, LABELS);

        assertEquals(2, grouping.dimensionCount());
        assertEquals(4, grouping.indicatorCount());
        assertEquals("Y", grouping.getDimensions().get(0).getName());
        assertEquals(List.of(1, 3), grouping.getDimensions().get(0).getIndicatorIndices());
        assertEquals(List.of(0, 2), grouping.getDimensions().get(1).getIndicatorIndices());
        assertEquals("X", grouping.dimensionOf(0).getName());
        assertEquals("Y", grouping.dimensionOf(3).getName());
    }

    @Test
    @DisplayName("8 指標の例を 4 次元に分割できる")
    void groupsIndicatorExample() {
        DimensionGrouping grouping = DimensionGrouping.of(DanpFixtures.indicatorGrouping(),
                DanpFixtures.INDICATOR_LABELS);

        assertEquals(4, grouping.dimensionCount());
        assertEquals(5, grouping.getDimensions().get(1).size());
        assertEquals("Organizational ability", grouping.dimensionOf(7).getName());
    }

    @Test
    @DisplayName("指標を持たない次元は EmptyGroupException")
    void emptyDimensionIsRejected() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        groups.put("X", List.of("a", "b", "c", "d"));
        groups.put("Empty", List.of());

        EmptyGroupException e = assertThrows(EmptyGroupException.class,
                () -> DimensionGrouping.of(groups, LABELS));
        assertFalse(e.isUserCorrectable());
        assertEquals("EMPTY_GROUP", e.getReasonCode());
    }

    @Test
    @DisplayName("未知・重複・未割り当てのラベルは InvalidInputException")
    void invalidAssignmentsAreRejected() {
        Map<String, List<String>> unknown = new LinkedHashMap<>();
        unknown.put("X", List.of("a", "b", "c", "d", "z"));
        assertEquals("grouping", assertThrows(InvalidInputException.class,
                () -> DimensionGrouping.of(unknown, LABELS)).getField());

        Map<String, List<String>> duplicate = new LinkedHashMap<>();
        duplicate.put("X", List.of("a", "b"));
        duplicate.put("Y", List.of("b", "c", "d"));
        assertEquals("grouping", assertThrows(InvalidInputException.class,
                () -> DimensionGrouping.of(duplicate, LABELS)).getField());

        Map<String, List<String>> missing = new LinkedHashMap<>();
        missing.put("X", List.of("a", "b", "c"));
        assertEquals("grouping", assertThrows(InvalidInputException.class,
                () -> DimensionGrouping.of(missing, LABELS)).getField());

        assertThrows(InvalidInputException.class,
                () -> DimensionGrouping.of(new LinkedHashMap<>(), LABELS));
    }
}
