package com.stockpipe.data;

import com.stockpipe.model.PriceBar;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily bar provider.
 */
public interface PriceSource {

    /**
     * Bars dated within [from, to], ascending. Unparseable fields come back as null rather than
     * failing the whole response.
     *
     * @throws com.stockpipe.core.TransientFetchException for retryable failures, including an empty or malformed body
     */
    List<PriceBar> fetchDaily(String ticker, LocalDate from, LocalDate to);

    String name();
}
