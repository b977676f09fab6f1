package com.stockpipe.dataset;

import com.stockpipe.db.InMemoryLabelStore;
import com.stockpipe.db.InMemoryPriceBarStore;
import com.stockpipe.model.Label;
import com.stockpipe.model.PriceBar;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelGeneratorTest {

    private static PriceBar bar(String date, Double close) {
        return new PriceBar("AAPL", LocalDate.parse(date), close, close, close, close, 100L);
    }

    @Test
    void computeLabels_shouldUseNextClose() {
        List<Label> labels = LabelGenerator.computeLabels("AAPL", List.of(
                bar("2026-02-02", 100.0),
                bar("2026-02-03", 105.0),
                bar("2026-02-04", 95.0)
        ));

        assertEquals(2, labels.size());
        assertEquals(LocalDate.of(2026, 2, 2), labels.get(0).date);
        assertEquals(1, labels.get(0).labelBinary);
        assertEquals(0.05, labels.get(0).pctReturn, 1e-12);
        assertEquals(0, labels.get(1).labelBinary);
        assertEquals(-0.095238, labels.get(1).pctReturn, 1e-6);
        assertEquals(105.0, labels.get(1).closeT, 1e-12);
        assertEquals(95.0, labels.get(1).closeNext, 1e-12);
    }

    @Test
    void computeLabels_shouldLabelUnchangedCloseAsDown() {
        List<Label> labels = LabelGenerator.computeLabels("AAPL", List.of(bar("2026-02-02", 100.0), bar("2026-02-03", 100.0)));

        assertEquals(0, labels.get(0).labelBinary);
        assertEquals(0.0, labels.get(0).pctReturn, 1e-12);
    }

    @Test
    void computeLabels_shouldSkipUnusableClosesAndSortInput() {
        List<Label> labels = LabelGenerator.computeLabels("AAPL", List.of(
                bar("2026-02-04", 110.0),
                bar("2026-02-03", null),
                bar("2026-02-02", 100.0),
                bar("2026-02-05", 0.0)
        ));

        assertEquals(1, labels.size());
        assertEquals(LocalDate.of(2026, 2, 2), labels.get(0).date);
        assertEquals(110.0, labels.get(0).closeNext, 1e-12);
    }

    @Test
    void computeLabels_shouldReturnNothingForSingleBar() {
        assertTrue(LabelGenerator.computeLabels("AAPL", List.of(bar("2026-02-02", 100.0))).isEmpty());
        assertTrue(LabelGenerator.computeLabels("AAPL", List.of()).isEmpty());
    }

    @Test
    void generate_shouldWriteOnceAndSkipExistingOnRerun() throws Exception {
        InMemoryPriceBarStore prices = new InMemoryPriceBarStore();
        InMemoryLabelStore labels = new InMemoryLabelStore();
        prices.insertIfAbsent(List.of(bar("2026-02-02", 100.0), bar("2026-02-03", 105.0), bar("2026-02-04", 95.0)));
        LabelGenerator generator = new LabelGenerator(prices, labels);

        LabelGenerator.LabelSummary first = generator.generate(List.of("AAPL", "EMPTY"));
        LabelGenerator.LabelSummary second = generator.generate(List.of("AAPL"));

        assertEquals(2, first.totalWritten());
        assertEquals(0, first.getWritten().get("EMPTY"));
        assertEquals(0, second.totalWritten());
        assertEquals(2, second.totalExisting());
        assertEquals(2, labels.size());
    }

    @Test
    void generate_shouldExtendLabelsWhenNewBarArrives() throws Exception {
        InMemoryPriceBarStore prices = new InMemoryPriceBarStore();
        InMemoryLabelStore labels = new InMemoryLabelStore();
        prices.insertIfAbsent(List.of(bar("2026-02-02", 100.0), bar("2026-02-03", 105.0)));
        LabelGenerator generator = new LabelGenerator(prices, labels);
        generator.generate(List.of("AAPL"));

        prices.insertIfAbsent(List.of(bar("2026-02-04", 95.0)));
        LabelGenerator.LabelSummary summary = generator.generate(List.of("AAPL"));

        assertEquals(1, summary.totalWritten());
        assertEquals(LocalDate.of(2026, 2, 3), labels.loadLabels("AAPL").get(1).date);
    }
}
