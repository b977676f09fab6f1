package com.stockpipe.dataset;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Headlines that were public before the cutoff for {@code predictionDate}, with the label for
 * that session when one exists.
 */
@Value
@Builder
public class NewsDatasetRow {
    String ticker;
    LocalDate predictionDate;
    List<String> headlines;
    Integer label;
    Double pctReturn;

    public int articleCount() {
        return headlines.size();
    }

    public boolean labeled() {
        return label != null;
    }
}
