package com.stockpipe.data;

import java.time.LocalDate;
import java.util.List;

/**
 * Company news provider. Items are returned as the provider reported them; standardization happens downstream.
 *
 * An empty list is a valid answer.
 */
public interface NewsSource {

    List<RawArticle> fetchCompanyNews(String ticker, LocalDate from, LocalDate to);

    String name();
}
