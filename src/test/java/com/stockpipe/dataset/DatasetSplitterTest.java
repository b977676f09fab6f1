package com.stockpipe.dataset;

import com.stockpipe.core.InsufficientDataException;
import com.stockpipe.model.Label;
import com.stockpipe.model.SplitAssignment;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetSplitterTest {
    private static final LocalDate START = LocalDate.of(2025, 1, 1);

    private static List<LocalDate> dates(int n) {
        List<LocalDate> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(START.plusDays(i));
        }
        return out;
    }

    @Test
    void split_shouldPartitionTenDatesSevenOneTwo() {
        SplitAssignment split = new DatasetSplitter().split(dates(10));

        assertEquals(7, split.getTrain().size());
        assertEquals(1, split.getVal().size());
        assertEquals(2, split.getTest().size());
        assertEquals(7, split.getTrainEnd());
        assertEquals(8, split.getValEnd());
    }

    @Test
    void split_shouldAssignEveryDateOnceInChronologicalOrder() {
        List<LocalDate> input = dates(57);
        List<LocalDate> shuffled = new ArrayList<>(input);
        Collections.reverse(shuffled);
        shuffled.addAll(input.subList(0, 10));

        SplitAssignment split = new DatasetSplitter().split(shuffled);

        assertEquals(57, split.totalDates());
        Set<LocalDate> seen = new HashSet<>();
        seen.addAll(split.getTrain());
        seen.addAll(split.getVal());
        seen.addAll(split.getTest());
        assertEquals(new HashSet<>(input), seen);
        assertTrue(last(split.getTrain()).isBefore(split.getVal().get(0)));
        assertTrue(last(split.getVal()).isBefore(split.getTest().get(0)));
        assertEquals(SplitAssignment.TEST, split.partitionOf(last(input)));
    }

    @Test
    void split_shouldApproximateRatiosOnLargeInput() {
        SplitAssignment split = new DatasetSplitter().split(dates(1000));

        assertEquals(700, split.getTrain().size());
        assertEquals(150, split.getVal().size());
        assertEquals(150, split.getTest().size());
    }

    @Test
    void split_shouldGiveEachPartitionAtLeastOneDateOnTinyInput() {
        SplitAssignment split = new DatasetSplitter().split(dates(3));

        assertEquals(1, split.getTrain().size());
        assertEquals(1, split.getVal().size());
        assertEquals(1, split.getTest().size());
    }

    @Test
    void split_shouldFailBelowMinimumDates() {
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> new DatasetSplitter().split(dates(2)));

        assertEquals(3, e.required());
        assertEquals(2, e.actual());
        assertThrows(InsufficientDataException.class,
                () -> new DatasetSplitter(SplitRatios.defaults(), 10).split(dates(9)));
    }

    @Test
    void splitRatios_shouldRejectInvalidCombinations() {
        assertThrows(IllegalArgumentException.class, () -> new SplitRatios(0.7, 0.2, 0.2));
        assertThrows(IllegalArgumentException.class, () -> SplitRatios.of(0.9, 0.1));
        assertThrows(IllegalArgumentException.class, () -> SplitRatios.of(-0.1, 0.5));
    }

    @Test
    void splitLabels_shouldShareDatePartitionAcrossTickers() {
        List<Label> labels = new ArrayList<>();
        for (LocalDate d : dates(10)) {
            labels.add(new Label("AAPL", d, 1, 0.01, 100, 101));
            labels.add(new Label("NVDA", d, 0, -0.01, 50, 49.5));
        }

        SplitAssignment split = new DatasetSplitter().splitLabels(labels);

        assertEquals(10, split.totalDates());
        assertEquals(14, split.getRowCounts().get(SplitAssignment.TRAIN));
        assertEquals(2, split.getRowCounts().get(SplitAssignment.VAL));
        assertEquals(4, split.getRowCounts().get(SplitAssignment.TEST));
    }

    @Test
    void split_shouldRejectNullDates() {
        List<LocalDate> withNull = dates(5);
        withNull.add(2, null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new DatasetSplitter().split(withNull));
        assertTrue(e.getMessage().contains("null"));
        assertThrows(IllegalArgumentException.class, () -> new DatasetSplitter().split(null));
    }

    private static LocalDate last(List<LocalDate> dates) {
        return dates.get(dates.size() - 1);
    }
}
