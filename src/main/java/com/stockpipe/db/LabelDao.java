package com.stockpipe.db;

import com.stockpipe.db.mybatis.LabelMapper;
import com.stockpipe.db.mybatis.LabelRow;
import com.stockpipe.db.mybatis.MyBatisSupport;
import com.stockpipe.model.Label;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class LabelDao implements LabelStore {
    private final Database database;

    public LabelDao(Database database) {
        this.database = database;
    }

    @Override
    public int insertIfAbsent(List<Label> labels) throws SQLException {
        if (labels == null || labels.isEmpty()) {
            return 0;
        }
        int added = 0;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            LabelMapper mapper = session.getMapper(LabelMapper.class);
            for (Label label : labels) {
                added += mapper.insertIfAbsent(LabelRow.builder()
                        .ticker(label.ticker)
                        .date(label.date)
                        .labelBinary(label.labelBinary)
                        .pctReturn(label.pctReturn)
                        .closeT(label.closeT)
                        .closeNext(label.closeNext)
                        .build());
            }
            conn.commit();
        }
        return added;
    }

    @Override
    public List<Label> loadLabels(String ticker) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toLabels(session.getMapper(LabelMapper.class).selectByTicker(ticker.trim().toUpperCase(Locale.ROOT)));
        }
    }

    @Override
    public List<Label> loadAll() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toLabels(session.getMapper(LabelMapper.class).selectAll());
        }
    }

    private List<Label> toLabels(List<LabelRow> rows) {
        List<Label> out = new ArrayList<>(rows.size());
        for (LabelRow row : rows) {
            out.add(new Label(
                    row.getTicker(),
                    row.getDate(),
                    row.getLabelBinary() == null ? 0 : row.getLabelBinary(),
                    row.getPctReturn() == null ? 0.0 : row.getPctReturn(),
                    row.getCloseT() == null ? 0.0 : row.getCloseT(),
                    row.getCloseNext() == null ? 0.0 : row.getCloseNext()
            ));
        }
        return out;
    }
}
