package com.stockpipe.db;

import com.stockpipe.model.Label;

import java.sql.SQLException;
import java.util.List;

public interface LabelStore {

    /**
     * @return number of labels inserted; labels for an existing (ticker, date) are left as they are
     */
    int insertIfAbsent(List<Label> labels) throws SQLException;

    List<Label> loadLabels(String ticker) throws SQLException;

    List<Label> loadAll() throws SQLException;
}
