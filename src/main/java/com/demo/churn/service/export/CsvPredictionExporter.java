package com.demo.churn.service.export;

import com.demo.churn.service.dto.ChurnPrediction;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/** Writes predictions as a comma-separated file with one header row. */
@Slf4j
public class CsvPredictionExporter implements PredictionSink {

    private static final DateTimeFormatter CREATED_ON = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path output;
    private final HeaderStyle headerStyle;

    public CsvPredictionExporter(Path output, HeaderStyle headerStyle) {
        this.output = output;
        this.headerStyle = headerStyle;
    }

    @Override
    public String write(List<ChurnPrediction> predictions, boolean includeActual) {
        Path target = output.toAbsolutePath().normalize();
        try {
            if (target.getParent() != null) Files.createDirectories(target.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                writeTo(w, predictions, includeActual);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write predictions to " + target, e);
        }
        log.info("Saved predictions for {} customers to: {}", predictions.size(), target);
        return target.toString();
    }

    void writeTo(Writer w, List<ChurnPrediction> predictions, boolean includeActual) throws IOException {
        List<PredictionColumn> columns = PredictionColumn.layout(headerStyle, includeActual);
        w.write(columns.stream().map(c -> escape(c.header(headerStyle))).collect(Collectors.joining(",")));
        w.write("\n");
        for (ChurnPrediction p : predictions) {
            w.write(columns.stream().map(c -> escape(render(c.valueOf(p)))).collect(Collectors.joining(",")));
            w.write("\n");
        }
    }

    private static String render(Object value) {
        if (value == null) return "";
        if (value instanceof LocalDateTime) return CREATED_ON.format((LocalDateTime) value);
        return value.toString();
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return "\"" + field.replace("\"", "\"\"") + "\"";
    }
}
