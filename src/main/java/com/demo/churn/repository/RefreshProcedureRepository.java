package com.demo.churn.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.simple.SimpleJdbcCall;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.util.Map;

@Slf4j
@Repository
@RequiredArgsConstructor
public class RefreshProcedureRepository {

    private final DataSource dataSource;

    /** Runs a parameterless stored procedure, e.g. the one that rebuilds the churn feature table. */
    @Retryable(retryFor = {TransientDataAccessException.class, DataAccessResourceFailureException.class},
            maxAttemptsExpression = "${churn.db.retry.max-attempts:5}",
            backoff = @Backoff(delayExpression = "${churn.db.retry.delay-ms:2000}", multiplier = 2))
    public void execute(String schema, String procedure) {
        SimpleJdbcCall call = new SimpleJdbcCall(dataSource)
                .withSchemaName(schema)
                .withProcedureName(procedure)
                .withoutProcedureColumnMetaDataAccess();
        log.info("Executing stored procedure {}.{}", schema, procedure);
        call.execute(Map.of());
    }
}
