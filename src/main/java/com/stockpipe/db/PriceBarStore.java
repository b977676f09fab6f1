package com.stockpipe.db;

import com.stockpipe.model.PriceBar;

import java.sql.SQLException;
import java.util.List;

/**
 * Insert-if-absent storage of daily bars keyed by (ticker, date). Existing rows are never updated.
 */
public interface PriceBarStore {

    /**
     * @return number of bars actually inserted; the rest were already present
     */
    int insertIfAbsent(List<PriceBar> bars) throws SQLException;

    /**
     * All bars for a ticker in ascending date order.
     */
    List<PriceBar> loadSeries(String ticker) throws SQLException;

    List<String> listTickers() throws SQLException;
}
