package com.demo.churn.repository;

import com.demo.churn.service.dto.ChurnPrediction;
import com.demo.churn.service.export.LoadMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PredictionRepositoryTest {

    private static final String FQ = "[dbo].[CustomerChurnPredictions]";

    @Mock
    private JdbcTemplate jdbc;

    @InjectMocks
    private PredictionRepository repository;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(repository, "schema", "dbo");
        ReflectionTestUtils.setField(repository, "table", "CustomerChurnPredictions");
    }

    private void tableExists(boolean exists) {
        when(jdbc.queryForObject(anyString(), eq(Integer.class), any())).thenReturn(exists ? 1 : 0);
    }

    @Test
    void createTableSql_listsFriendlyColumnsWithTypes() {
        String sql = PredictionRepository.createTableSql(FQ);

        assertThat(sql).startsWith("CREATE TABLE " + FQ);
        assertThat(sql).contains("[CustomerId] INT NULL", "[SnapshotDate] DATE NULL",
                "[ChurnProbabilityPctNext90Days] DECIMAL(5,2) NULL", "[CreatedOn] DATETIME NULL");
    }

    @Test
    void failModeRefusesExistingTable() {
        tableExists(true);

        assertThatThrownBy(() -> repository.save(List.<ChurnPrediction>of(), LoadMode.FAIL))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(FQ);
        verify(jdbc, never()).execute(anyString());
    }

    @Test
    @SuppressWarnings("unchecked")
    void replaceModeDropsAndRecreates() {
        tableExists(true);

        String target = repository.save(List.of(), LoadMode.REPLACE);

        assertThat(target).isEqualTo(FQ);
        verify(jdbc).execute("DROP TABLE " + FQ);
        verify(jdbc).execute(startsWith("CREATE TABLE " + FQ));
        verify(jdbc).batchUpdate(startsWith("INSERT INTO " + FQ), anyList(), eq(1000),
                any(ParameterizedPreparedStatementSetter.class));
    }

    @Test
    void appendModeKeepsExistingTable() {
        tableExists(true);

        repository.save(List.of(), LoadMode.APPEND);

        verify(jdbc, never()).execute(anyString());
    }

    @Test
    void appendModeCreatesMissingTable() {
        tableExists(false);

        repository.save(List.of(), LoadMode.APPEND);

        verify(jdbc).execute(startsWith("CREATE TABLE"));
        verify(jdbc, never()).execute(startsWith("DROP"));
    }
}
