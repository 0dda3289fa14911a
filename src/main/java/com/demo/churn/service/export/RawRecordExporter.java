package com.demo.churn.service.export;

import com.demo.churn.service.features.ChurnFeature;
import com.demo.churn.service.features.ChurnRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dumps source rows as they came from the feature query: id, snapshot date, the 26
 * features and the label column when the run has one. Values are written unconverted.
 */
@Slf4j
public class RawRecordExporter {

    static final String CUSTOMER_ID = "customer_id";
    static final String AS_OF_DATE = "as_of_date";

    private final Path output;

    public RawRecordExporter(Path output) {
        this.output = output;
    }

    public String write(List<ChurnRecord> records, String labelColumn) {
        Path target = output.toAbsolutePath().normalize();
        try {
            if (target.getParent() != null) Files.createDirectories(target.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                writeTo(w, records, labelColumn);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write raw rows to " + target, e);
        }
        log.info("Saved raw rows: {} -> {}", records.size(), target);
        return target.toString();
    }

    void writeTo(Writer w, List<ChurnRecord> records, String labelColumn) throws IOException {
        List<String> header = new ArrayList<>();
        header.add(CUSTOMER_ID);
        header.add(AS_OF_DATE);
        header.addAll(ChurnFeature.columns());
        if (labelColumn != null) header.add(labelColumn);
        writeLine(w, header);

        for (ChurnRecord r : records) {
            List<String> cells = new ArrayList<>(header.size());
            cells.add(Long.toString(r.customerId()));
            cells.add(r.asOfDate() == null ? "" : r.asOfDate());
            for (String c : ChurnFeature.columns()) cells.add(text(r.feature(c)));
            if (labelColumn != null) cells.add(text(r.label()));
            writeLine(w, cells);
        }
    }

    private static void writeLine(Writer w, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) w.write(',');
            w.write(CsvPredictionExporter.escape(cells.get(i)));
        }
        w.write('\n');
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
