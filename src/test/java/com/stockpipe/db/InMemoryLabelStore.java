package com.stockpipe.db;

import com.stockpipe.model.Label;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class InMemoryLabelStore implements LabelStore {
    private final Map<String, Label> rows = new TreeMap<>();

    @Override
    public int insertIfAbsent(List<Label> labels) {
        int added = 0;
        for (Label label : labels) {
            if (rows.putIfAbsent(label.key(), label) == null) {
                added++;
            }
        }
        return added;
    }

    @Override
    public List<Label> loadLabels(String ticker) {
        List<Label> out = new ArrayList<>();
        for (Label label : rows.values()) {
            if (label.ticker.equals(ticker)) {
                out.add(label);
            }
        }
        out.sort(Comparator.comparing(l -> l.date));
        return out;
    }

    @Override
    public List<Label> loadAll() {
        return new ArrayList<>(rows.values());
    }

    public int size() {
        return rows.size();
    }
}
