package com.stockpipe.dataset;

import com.stockpipe.model.SplitAssignment;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists split assignments as JSON under {@code <outputs>/splits/split_<first>_<last>.json}.
 */
public final class SplitSnapshotWriter {
    private final Path splitsDir;

    public SplitSnapshotWriter(Path outputsDir) {
        this.splitsDir = outputsDir.resolve("splits");
    }

    public Path save(SplitAssignment assignment) throws IOException {
        Path target = pathFor(assignment.firstDate(), assignment.lastDate());
        Files.createDirectories(splitsDir);
        Files.writeString(target, toJson(assignment).toString(2), StandardCharsets.UTF_8);
        System.out.println("split snapshot saved path=" + target.toAbsolutePath()
                + " dates=" + assignment.totalDates());
        return target;
    }

    public SplitAssignment load(LocalDate first, LocalDate last) throws IOException {
        Path source = pathFor(first, last);
        return fromJson(new JSONObject(Files.readString(source, StandardCharsets.UTF_8)));
    }

    public Path pathFor(LocalDate first, LocalDate last) {
        return splitsDir.resolve("split_" + first + "_" + last + ".json");
    }

    static JSONObject toJson(SplitAssignment a) {
        JSONObject root = new JSONObject();
        root.put("first_date", a.firstDate().toString());
        root.put("last_date", a.lastDate().toString());
        root.put("n_dates", a.totalDates());
        root.put("ratios", new JSONObject()
                .put("train", a.getTrainRatio())
                .put("val", a.getValRatio())
                .put("test", a.getTestRatio()));
        root.put("boundaries", new JSONObject()
                .put("train_end", a.getTrainEnd())
                .put("val_end", a.getValEnd()));
        root.put(SplitAssignment.TRAIN, datesToJson(a.getTrain()));
        root.put(SplitAssignment.VAL, datesToJson(a.getVal()));
        root.put(SplitAssignment.TEST, datesToJson(a.getTest()));
        JSONObject counts = new JSONObject();
        if (a.getRowCounts() != null) {
            for (Map.Entry<String, Integer> e : a.getRowCounts().entrySet()) {
                counts.put(e.getKey(), e.getValue());
            }
        }
        root.put("row_counts", counts);
        return root;
    }

    static SplitAssignment fromJson(JSONObject root) {
        JSONObject ratios = root.getJSONObject("ratios");
        JSONObject boundaries = root.getJSONObject("boundaries");
        Map<String, Integer> counts = new LinkedHashMap<>();
        JSONObject rowCounts = root.optJSONObject("row_counts");
        if (rowCounts != null) {
            for (String partition : List.of(SplitAssignment.TRAIN, SplitAssignment.VAL, SplitAssignment.TEST)) {
                if (rowCounts.has(partition)) {
                    counts.put(partition, rowCounts.getInt(partition));
                }
            }
        }
        return SplitAssignment.builder()
                .train(datesFromJson(root.getJSONArray(SplitAssignment.TRAIN)))
                .val(datesFromJson(root.getJSONArray(SplitAssignment.VAL)))
                .test(datesFromJson(root.getJSONArray(SplitAssignment.TEST)))
                .trainEnd(boundaries.getInt("train_end"))
                .valEnd(boundaries.getInt("val_end"))
                .trainRatio(ratios.getDouble("train"))
                .valRatio(ratios.getDouble("val"))
                .testRatio(ratios.getDouble("test"))
                .rowCounts(counts)
                .build();
    }

    private static JSONArray datesToJson(List<LocalDate> dates) {
        JSONArray out = new JSONArray();
        for (LocalDate d : dates) {
            out.put(d.toString());
        }
        return out;
    }

    private static List<LocalDate> datesFromJson(JSONArray array) {
        List<LocalDate> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            out.add(LocalDate.parse(array.getString(i)));
        }
        return out;
    }
}
