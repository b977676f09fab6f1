package com.stockpipe.db;

import com.stockpipe.model.PriceBar;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

public final class InMemoryPriceBarStore implements PriceBarStore {
    private final Map<String, PriceBar> rows = new TreeMap<>();
    public int insertCalls;

    @Override
    public int insertIfAbsent(List<PriceBar> bars) {
        insertCalls++;
        int added = 0;
        for (PriceBar bar : bars) {
            if (rows.putIfAbsent(bar.key(), bar) == null) {
                added++;
            }
        }
        return added;
    }

    @Override
    public List<PriceBar> loadSeries(String ticker) {
        List<PriceBar> out = new ArrayList<>();
        for (PriceBar bar : rows.values()) {
            if (bar.ticker.equals(ticker)) {
                out.add(bar);
            }
        }
        out.sort(Comparator.comparing(b -> b.date));
        return out;
    }

    @Override
    public List<String> listTickers() {
        TreeSet<String> out = new TreeSet<>();
        for (PriceBar bar : rows.values()) {
            out.add(bar.ticker);
        }
        return new ArrayList<>(out);
    }

    public int size() {
        return rows.size();
    }
}
