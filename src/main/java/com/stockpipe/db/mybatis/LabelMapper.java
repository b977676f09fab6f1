package com.stockpipe.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface LabelMapper {
    @Insert("INSERT INTO labels(ticker, date, label_binary, pct_return, close_t, close_next) " +
            "VALUES(#{ticker}, #{date}, #{labelBinary}, #{pctReturn}, #{closeT}, #{closeNext}) " +
            "ON CONFLICT(ticker, date) DO NOTHING")
    int insertIfAbsent(LabelRow row);

    @Select("SELECT ticker, date, label_binary, pct_return, close_t, close_next " +
            "FROM labels WHERE ticker=#{ticker} ORDER BY date ASC")
    List<LabelRow> selectByTicker(@Param("ticker") String ticker);

    @Select("SELECT ticker, date, label_binary, pct_return, close_t, close_next " +
            "FROM labels ORDER BY date ASC, ticker ASC")
    List<LabelRow> selectAll();
}
