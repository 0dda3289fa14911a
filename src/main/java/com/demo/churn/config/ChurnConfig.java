package com.demo.churn.config;

import com.demo.churn.service.refresh.RefreshExecutor;
import com.demo.churn.service.refresh.RefreshGate;
import com.demo.churn.service.refresh.RefreshGateStateStore;
import com.demo.churn.service.refresh.RefreshTarget;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class ChurnConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** The feature-table build procedure, keyed by server and database so each environment keeps its own TTL. */
    @Bean
    public RefreshTarget refreshTarget(@Value("${churn.refresh.server:${MSSQL_SERVER:localhost}}") String server,
                                       @Value("${churn.refresh.database:${MSSQL_DATABASE:SAP}}") String database,
                                       @Value("${churn.refresh.schema:dbo}") String schema,
                                       @Value("${churn.refresh.procedure:sp_build_customer_churn_cadence_v1}") String procedure) {
        return new RefreshTarget(server, database, schema, procedure);
    }

    @Bean
    public RefreshGateStateStore refreshGateStateStore(@Value("${churn.refresh.state-file:.state/sp_runs.json}") String stateFile,
                                                       ObjectMapper objectMapper) {
        return new RefreshGateStateStore(Path.of(stateFile), objectMapper);
    }

    @Bean
    public RefreshGate refreshGate(RefreshExecutor executor, Clock clock) {
        return new RefreshGate(executor, clock);
    }
}
