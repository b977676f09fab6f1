package com.stockpipe.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface NewsMapper {
    @Insert("INSERT INTO news(url, ticker_fetched_for, title, source, published_at, summary, collected_at) " +
            "VALUES(#{url}, #{tickerFetchedFor}, #{title,jdbcType=VARCHAR}, #{source,jdbcType=VARCHAR}, " +
            "#{publishedAt,jdbcType=TIMESTAMP_WITH_TIMEZONE}, #{summary,jdbcType=VARCHAR}, COALESCE(#{collectedAt,jdbcType=TIMESTAMP_WITH_TIMEZONE}, now())) " +
            "ON CONFLICT(url) DO NOTHING")
    int insertIfAbsent(NewsRow row);

    @Select("SELECT url, ticker_fetched_for, title, source, published_at, summary, collected_at " +
            "FROM news WHERE ticker_fetched_for=#{ticker} ORDER BY published_at ASC NULLS LAST, id ASC")
    List<NewsRow> selectByTicker(@Param("ticker") String ticker);

    @Select("SELECT url, ticker_fetched_for, title, source, published_at, summary, collected_at " +
            "FROM news ORDER BY published_at ASC NULLS LAST, id ASC")
    List<NewsRow> selectAll();
}
