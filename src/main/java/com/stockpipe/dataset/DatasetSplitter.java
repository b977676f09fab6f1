package com.stockpipe.dataset;

import com.stockpipe.core.InsufficientDataException;
import com.stockpipe.model.Label;
import com.stockpipe.model.SplitAssignment;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Chronological train/val/test partition over distinct labeled dates. Dates are global across
 * tickers, so every ticker observed on a date shares that date's partition.
 */
public final class DatasetSplitter {
    public static final int MIN_DATES_FLOOR = 3;

    private final SplitRatios defaultRatios;
    private final int minDates;

    public DatasetSplitter() {
        this(SplitRatios.defaults(), MIN_DATES_FLOOR);
    }

    public DatasetSplitter(SplitRatios defaultRatios, int minDates) {
        this.defaultRatios = defaultRatios == null ? SplitRatios.defaults() : defaultRatios;
        this.minDates = Math.max(MIN_DATES_FLOOR, minDates);
    }

    public SplitAssignment split(Collection<LocalDate> labeledDates) {
        return split(labeledDates, defaultRatios);
    }

    public SplitAssignment split(Collection<LocalDate> labeledDates, SplitRatios ratios) {
        return split(labeledDates, ratios, Map.of());
    }

    public SplitAssignment splitLabels(List<Label> labels) {
        List<LocalDate> dates = new ArrayList<>();
        for (Label label : labels) {
            dates.add(label.date);
        }
        SplitAssignment dateSplit = split(dates, defaultRatios);
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(SplitAssignment.TRAIN, 0);
        counts.put(SplitAssignment.VAL, 0);
        counts.put(SplitAssignment.TEST, 0);
        LocalDate lastTrain = dateSplit.getTrain().get(dateSplit.getTrain().size() - 1);
        LocalDate lastVal = dateSplit.getVal().get(dateSplit.getVal().size() - 1);
        for (Label label : labels) {
            String partition;
            if (!label.date.isAfter(lastTrain)) {
                partition = SplitAssignment.TRAIN;
            } else if (!label.date.isAfter(lastVal)) {
                partition = SplitAssignment.VAL;
            } else {
                partition = SplitAssignment.TEST;
            }
            counts.merge(partition, 1, Integer::sum);
        }
        return dateSplit.toBuilder().rowCounts(counts).build();
    }

    private SplitAssignment split(Collection<LocalDate> labeledDates, SplitRatios ratios, Map<String, Integer> rowCounts) {
        if (labeledDates == null) {
            throw new IllegalArgumentException("labeled dates must not be null");
        }
        TreeSet<LocalDate> distinct = new TreeSet<>();
        for (LocalDate date : labeledDates) {
            if (date == null) {
                throw new IllegalArgumentException("labeled dates must not contain null");
            }
            distinct.add(date);
        }
        List<LocalDate> dates = new ArrayList<>(distinct);
        int n = dates.size();
        if (n < minDates) {
            throw new InsufficientDataException("distinct labeled dates", minDates, n);
        }
        int trainEnd = (int) Math.floor(n * ratios.getTrain() + 1e-9);
        int valEnd = (int) Math.floor(n * (ratios.getTrain() + ratios.getVal()) + 1e-9);
        trainEnd = Math.max(1, Math.min(trainEnd, n - 2));
        valEnd = Math.max(trainEnd + 1, Math.min(valEnd, n - 1));

        SplitAssignment out = SplitAssignment.builder()
                .train(List.copyOf(dates.subList(0, trainEnd)))
                .val(List.copyOf(dates.subList(trainEnd, valEnd)))
                .test(List.copyOf(dates.subList(valEnd, n)))
                .trainEnd(trainEnd)
                .valEnd(valEnd)
                .trainRatio(ratios.getTrain())
                .valRatio(ratios.getVal())
                .testRatio(ratios.getTest())
                .rowCounts(rowCounts)
                .build();
        System.out.println("split dates=" + n
                + " train=" + out.getTrain().size()
                + " val=" + out.getVal().size()
                + " test=" + out.getTest().size()
                + " first=" + dates.get(0)
                + " last=" + dates.get(n - 1));
        return out;
    }
}
