package com.demo.churn.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ConnectivityRepository {

    private final JdbcTemplate jdbc;

    @Retryable(retryFor = {TransientDataAccessException.class, DataAccessResourceFailureException.class},
            maxAttemptsExpression = "${churn.db.retry.max-attempts:5}",
            backoff = @Backoff(delayExpression = "${churn.db.retry.delay-ms:2000}", multiplier = 2))
    public ConnectionInfo check() {
        return jdbc.queryForObject(
                "SELECT @@VERSION AS version, DB_NAME() AS db, SUSER_SNAME() AS login",
                (rs, i) -> new ConnectionInfo(
                        firstLine(rs.getString("version")),
                        rs.getString("db"),
                        rs.getString("login")));
    }

    private static String firstLine(String s) {
        if (s == null) return null;
        int nl = s.indexOf('\n');
        return (nl < 0 ? s : s.substring(0, nl)).trim();
    }

    public record ConnectionInfo(String serverVersion, String database, String user) {}
}
