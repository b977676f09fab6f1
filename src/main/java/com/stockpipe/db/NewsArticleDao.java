package com.stockpipe.db;

import com.stockpipe.db.mybatis.MyBatisSupport;
import com.stockpipe.db.mybatis.NewsMapper;
import com.stockpipe.db.mybatis.NewsRow;
import com.stockpipe.model.NewsArticle;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * DAO for the news table. The url is the identity: an article already stored under another ticker is skipped.
 */
public final class NewsArticleDao implements NewsArticleStore {
    private final Database database;

    public NewsArticleDao(Database database) {
        this.database = database;
    }

    @Override
    public int insertIfAbsent(List<NewsArticle> articles) throws SQLException {
        if (articles == null || articles.isEmpty()) {
            return 0;
        }
        int added = 0;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            NewsMapper mapper = session.getMapper(NewsMapper.class);
            for (NewsArticle article : articles) {
                if (article == null || article.url == null || article.url.isBlank()) {
                    continue;
                }
                added += mapper.insertIfAbsent(NewsRow.builder()
                        .url(article.url)
                        .tickerFetchedFor(article.tickerFetchedFor)
                        .title(article.title)
                        .source(article.source)
                        .publishedAt(article.publishedAt)
                        .summary(article.summary)
                        .collectedAt(article.collectedAt)
                        .build());
            }
            conn.commit();
        }
        return added;
    }

    @Override
    public List<NewsArticle> loadByTicker(String ticker) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toArticles(session.getMapper(NewsMapper.class).selectByTicker(ticker.trim().toUpperCase(Locale.ROOT)));
        }
    }

    @Override
    public List<NewsArticle> loadAll() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toArticles(session.getMapper(NewsMapper.class).selectAll());
        }
    }

    private List<NewsArticle> toArticles(List<NewsRow> rows) {
        List<NewsArticle> out = new ArrayList<>(rows.size());
        for (NewsRow row : rows) {
            out.add(new NewsArticle(
                    row.getUrl(),
                    row.getTickerFetchedFor(),
                    row.getTitle(),
                    row.getSource(),
                    row.getPublishedAt(),
                    row.getSummary(),
                    row.getCollectedAt()
            ));
        }
        return out;
    }
}
