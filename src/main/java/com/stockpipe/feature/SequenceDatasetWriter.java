package com.stockpipe.feature;

import com.stockpipe.model.IndicatorRow;
import com.stockpipe.model.SequenceSample;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes model-ready sequences as JSON lines: one object per window with its ticker, dates,
 * label and the normalized rows in {@link IndicatorRow#FEATURE_NAMES} column order.
 */
public final class SequenceDatasetWriter {
    public static final String FILE_NAME = "sequences.jsonl";

    private final Path datasetsDir;

    public SequenceDatasetWriter(Path outputsDir) {
        this.datasetsDir = outputsDir.resolve("datasets");
    }

    public Path target() {
        return datasetsDir.resolve(FILE_NAME);
    }

    public Path write(List<SequenceSample> samples) throws IOException {
        Path target = target();
        Files.createDirectories(datasetsDir);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (SequenceSample sample : samples) {
                writer.write(toJson(sample).toString());
                writer.newLine();
            }
        }
        System.out.println("sequences saved path=" + target.toAbsolutePath() + " samples=" + samples.size());
        return target;
    }

    static JSONObject toJson(SequenceSample sample) {
        JSONArray window = new JSONArray();
        for (int step = 0; step < sample.length(); step++) {
            JSONArray row = new JSONArray();
            for (int f = 0; f < sample.featureCount(); f++) {
                row.put(sample.at(step, f));
            }
            window.put(row);
        }
        JSONObject obj = new JSONObject();
        obj.put("ticker", sample.ticker);
        obj.put("start_date", sample.startDate.toString());
        obj.put("end_date", sample.endDate.toString());
        obj.put("label", sample.label == null ? JSONObject.NULL : sample.label);
        obj.put("window", window);
        return obj;
    }
}
