package com.demo.churn.service.refresh;

import com.demo.churn.repository.RefreshProcedureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/** Refreshes the churn feature table by running its build procedure on the database. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoredProcedureRefreshExecutor implements RefreshExecutor {

    private final RefreshProcedureRepository procedures;

    @Override
    public RefreshResult execute(RefreshTarget target) {
        try {
            procedures.execute(target.schema(), target.procedure());
            return RefreshResult.ok();
        } catch (DataAccessException e) {
            String cause = e.getMostSpecificCause() != null ? e.getMostSpecificCause().getMessage() : e.getMessage();
            log.error("Stored procedure {} failed: {}", target.qualifiedName(), cause);
            return RefreshResult.failure(cause);
        }
    }
}
