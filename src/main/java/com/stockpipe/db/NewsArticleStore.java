package com.stockpipe.db;

import com.stockpipe.model.NewsArticle;

import java.sql.SQLException;
import java.util.List;

/**
 * Insert-if-absent storage of articles keyed by url.
 */
public interface NewsArticleStore {

    /**
     * @return number of articles actually inserted; an article whose url exists is skipped
     */
    int insertIfAbsent(List<NewsArticle> articles) throws SQLException;

    List<NewsArticle> loadByTicker(String ticker) throws SQLException;

    List<NewsArticle> loadAll() throws SQLException;
}
