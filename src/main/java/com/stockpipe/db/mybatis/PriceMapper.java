package com.stockpipe.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface PriceMapper {
    @Insert("INSERT INTO prices(ticker, date, open, high, low, close, volume, adjusted_close) " +
            "VALUES(#{ticker}, #{date}, #{open,jdbcType=DOUBLE}, #{high,jdbcType=DOUBLE}, #{low,jdbcType=DOUBLE}, " +
            "#{close,jdbcType=DOUBLE}, #{volume,jdbcType=BIGINT}, #{adjustedClose,jdbcType=DOUBLE}) " +
            "ON CONFLICT(ticker, date) DO NOTHING")
    int insertIfAbsent(PriceRow row);

    @Select("SELECT ticker, date, open, high, low, close, volume, adjusted_close " +
            "FROM prices WHERE ticker=#{ticker} ORDER BY date ASC")
    List<PriceRow> selectSeries(@Param("ticker") String ticker);

    @Select("SELECT DISTINCT ticker FROM prices ORDER BY ticker")
    List<String> selectTickers();
}
