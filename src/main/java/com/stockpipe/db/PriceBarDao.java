package com.stockpipe.db;

import com.stockpipe.db.mybatis.MyBatisSupport;
import com.stockpipe.db.mybatis.PriceMapper;
import com.stockpipe.db.mybatis.PriceRow;
import com.stockpipe.model.PriceBar;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class PriceBarDao implements PriceBarStore {
    private final Database database;

    public PriceBarDao(Database database) {
        this.database = database;
    }

    @Override
    public int insertIfAbsent(List<PriceBar> bars) throws SQLException {
        if (bars == null || bars.isEmpty()) {
            return 0;
        }
        int added = 0;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            PriceMapper mapper = session.getMapper(PriceMapper.class);
            for (PriceBar bar : bars) {
                if (bar == null || bar.ticker == null || bar.date == null) {
                    continue;
                }
                added += mapper.insertIfAbsent(PriceRow.builder()
                        .ticker(bar.ticker)
                        .date(bar.date)
                        .open(bar.open)
                        .high(bar.high)
                        .low(bar.low)
                        .close(bar.close)
                        .volume(bar.volume)
                        .adjustedClose(bar.adjustedClose)
                        .build());
            }
            conn.commit();
        }
        return added;
    }

    @Override
    public List<PriceBar> loadSeries(String ticker) throws SQLException {
        List<PriceBar> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            PriceMapper mapper = session.getMapper(PriceMapper.class);
            for (PriceRow row : mapper.selectSeries(ticker.trim().toUpperCase(Locale.ROOT))) {
                out.add(new PriceBar(
                        row.getTicker(),
                        row.getDate(),
                        row.getOpen(),
                        row.getHigh(),
                        row.getLow(),
                        row.getClose(),
                        row.getVolume(),
                        row.getAdjustedClose()
                ));
            }
        }
        return out;
    }

    @Override
    public List<String> listTickers() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return new ArrayList<>(session.getMapper(PriceMapper.class).selectTickers());
        }
    }
}
