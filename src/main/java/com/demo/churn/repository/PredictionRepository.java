package com.demo.churn.repository;

import com.demo.churn.service.dto.ChurnPrediction;
import com.demo.churn.service.export.LoadMode;
import com.demo.churn.service.export.PredictionColumn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Writes scoring results to the prediction table, creating it when missing. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PredictionRepository {

    private static final Map<PredictionColumn, String> SQL_TYPES = Map.ofEntries(
            Map.entry(PredictionColumn.CUSTOMER_ID, "INT"),
            Map.entry(PredictionColumn.SNAPSHOT_DATE, "DATE"),
            Map.entry(PredictionColumn.DAYS_SINCE_LAST_PURCHASE, "INT"),
            Map.entry(PredictionColumn.CHURNED_NOW, "BIT"),
            Map.entry(PredictionColumn.CHURNED_NOW_REASON, "NVARCHAR(MAX)"),
            Map.entry(PredictionColumn.ACTUAL_CHURNED, "BIT"),
            Map.entry(PredictionColumn.ACTUAL_CHURN_REASON, "NVARCHAR(MAX)"),
            Map.entry(PredictionColumn.PREDICTED_CHURN, "BIT"),
            Map.entry(PredictionColumn.CHURN_PROBABILITY_PCT, "DECIMAL(5,2)"),
            Map.entry(PredictionColumn.CHURN_PROBABILITY, "DECIMAL(9,6)"),
            Map.entry(PredictionColumn.PREDICTED_CHURN_REASON, "NVARCHAR(MAX)"),
            Map.entry(PredictionColumn.CREATED_ON, "DATETIME"));

    private static final List<PredictionColumn> COLUMNS = List.of(PredictionColumn.values());

    private final JdbcTemplate jdbc;

    @Value("${churn.output.table.schema:dbo}")
    private String schema;

    @Value("${churn.output.table.name:CustomerChurnPredictions}")
    private String table;

    @Transactional
    public String save(List<ChurnPrediction> predictions, LoadMode mode) {
        String fq = qualifiedName();
        boolean exists = tableExists(fq);
        switch (mode) {
            case FAIL:
                if (exists) throw new IllegalStateException("Table " + fq + " already exists");
                break;
            case REPLACE:
                if (exists) jdbc.execute("DROP TABLE " + fq);
                exists = false;
                break;
            case APPEND:
            default:
                break;
        }
        if (!exists) {
            jdbc.execute(createTableSql(fq));
        }

        String insert = "INSERT INTO " + fq + " ("
                + COLUMNS.stream().map(c -> "[" + c.tableColumn() + "]").collect(Collectors.joining(", "))
                + ") VALUES (" + COLUMNS.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";

        jdbc.batchUpdate(insert, predictions, 1000, (ps, p) -> {
            int k = 1;
            ps.setLong(k++, p.getCustomerId());
            LocalDate snapshot = parseDate(p.getSnapshotDate());
            if (snapshot == null) ps.setNull(k++, Types.DATE); else ps.setDate(k++, Date.valueOf(snapshot));
            ps.setLong(k++, p.getDaysSinceLastPurchaseToday());
            ps.setBoolean(k++, p.isChurnedNow());
            ps.setString(k++, p.getChurnedNowReason());
            if (p.getActualChurned() == null) ps.setNull(k++, Types.BIT); else ps.setBoolean(k++, p.getActualChurned() == 1);
            ps.setString(k++, p.getActualChurnReason());
            ps.setBoolean(k++, p.getPredictedChurn() == 1);
            ps.setBigDecimal(k++, BigDecimal.valueOf(p.getChurnProbabilityPct()).setScale(2, RoundingMode.HALF_UP));
            ps.setBigDecimal(k++, BigDecimal.valueOf(p.getChurnProbability()).setScale(6, RoundingMode.HALF_UP));
            ps.setString(k++, p.getPredictedChurnReason());
            ps.setTimestamp(k, Timestamp.valueOf(p.getCreatedOn()));
        });
        log.info("Loaded {} predictions into {} (mode={})", predictions.size(), fq, mode);
        return fq;
    }

    String qualifiedName() {
        return "[" + ChurnFeatureRepository.requireIdentifier(schema) + "].["
                + ChurnFeatureRepository.requireIdentifier(table) + "]";
    }

    private boolean tableExists(String fq) {
        Integer found = jdbc.queryForObject(
                "SELECT CASE WHEN OBJECT_ID(?, N'U') IS NULL THEN 0 ELSE 1 END", Integer.class, fq);
        return found != null && found == 1;
    }

    static String createTableSql(String fq) {
        String cols = COLUMNS.stream()
                .map(c -> "[" + c.tableColumn() + "] " + SQL_TYPES.get(c) + " NULL")
                .collect(Collectors.joining(",\n    "));
        return "CREATE TABLE " + fq + " (\n    " + cols + "\n)";
    }

    private static LocalDate parseDate(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return LocalDate.parse(s.trim().length() > 10 ? s.trim().substring(0, 10) : s.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
