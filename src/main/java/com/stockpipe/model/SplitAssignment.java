package com.stockpipe.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Chronological partition of labeled dates. Every date lands in exactly one list and
 * all train dates precede all val dates, which precede all test dates.
 */
@Value
@Builder(toBuilder = true)
public class SplitAssignment {
    public static final String TRAIN = "train";
    public static final String VAL = "val";
    public static final String TEST = "test";

    List<LocalDate> train;
    List<LocalDate> val;
    List<LocalDate> test;
    int trainEnd;
    int valEnd;
    double trainRatio;
    double valRatio;
    double testRatio;
    Map<String, Integer> rowCounts;

    public int totalDates() {
        return train.size() + val.size() + test.size();
    }

    public LocalDate firstDate() {
        return train.get(0);
    }

    public LocalDate lastDate() {
        return test.get(test.size() - 1);
    }

    public String partitionOf(LocalDate date) {
        if (train.contains(date)) {
            return TRAIN;
        }
        if (val.contains(date)) {
            return VAL;
        }
        if (test.contains(date)) {
            return TEST;
        }
        return null;
    }
}
