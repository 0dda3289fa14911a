package com.demo.churn.repository;

import com.demo.churn.service.features.ChurnFeature;
import com.demo.churn.service.features.ChurnRecord;
import com.demo.churn.service.features.ChurnRecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
@Repository
@RequiredArgsConstructor
public class ChurnFeatureRepository implements ChurnRecordSource {

    static final String CUSTOMER_ID_COL = "customer_id";
    static final String DATE_COL = "as_of_date";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbc;

    @Value("${churn.source.table:[SAP].[dbo].[CustomerChurnCadence_v1]}")
    private String sourceTable;

    @Override
    @Retryable(retryFor = {TransientDataAccessException.class, DataAccessResourceFailureException.class},
            maxAttemptsExpression = "${churn.db.retry.max-attempts:5}",
            backoff = @Backoff(delayExpression = "${churn.db.retry.delay-ms:2000}", multiplier = 2))
    public List<ChurnRecord> fetch(Integer top, String labelColumn) {
        String sql = churnQuery(sourceTable, top, labelColumn);
        log.debug("Fetching churn features: {}", sql);
        List<ChurnRecord> rows = jdbc.query(sql, rowMapper(labelColumn));
        log.info("Fetched {} churn feature rows from {}", rows.size(), sourceTable);
        return rows;
    }

    /** t0 is returned as yyyy-MM-dd, falling back to today's UTC date when NULL. */
    static String churnQuery(String table, Integer top, String labelColumn) {
        List<String> parts = new ArrayList<>();
        parts.add("[" + CUSTOMER_ID_COL + "]");
        parts.add("COALESCE(CONVERT(varchar(10), [t0], 23), CONVERT(varchar(10), SYSUTCDATETIME(), 23)) AS ["
                + DATE_COL + "]");
        for (String c : ChurnFeature.columns()) parts.add("[" + c + "]");
        if (labelColumn != null) parts.add("[" + requireIdentifier(labelColumn) + "]");

        String topClause = (top != null && top > 0) ? "TOP (" + top + ") " : "";
        return """
                SELECT %s%s
                FROM %s
                """.formatted(topClause, String.join(",\n       ", parts), table);
    }

    private RowMapper<ChurnRecord> rowMapper(String labelColumn) {
        List<String> columns = ChurnFeature.columns();
        return (rs, i) -> {
            Map<String, Object> features = new LinkedHashMap<>();
            for (String c : columns) features.put(c, rs.getObject(c));
            Object label = labelColumn == null ? null : rs.getObject(labelColumn);
            return new ChurnRecord(rs.getLong(CUSTOMER_ID_COL), rs.getString(DATE_COL), features, label);
        };
    }

    static String requireIdentifier(String name) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid column name: " + name);
        }
        return name;
    }
}
