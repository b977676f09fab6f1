package com.stockpipe.collect;

import java.util.Set;

/**
 * A data collection stage. Each call processes every ticker independently and appends exactly one run record.
 */
public interface Collector {

    /**
     * @param days calendar days of history to request, counted back from today in the market zone
     * @throws IllegalArgumentException when {@code days} is not positive
     */
    CollectionResult collect(Set<String> tickers, int days);

    String runType();
}
