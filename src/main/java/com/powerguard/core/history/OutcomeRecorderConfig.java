package com.powerguard.core.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link OutcomeRecorder}.
 * <p>
 * With {@code powerguard.history.store=jdbc} (the default) and a {@link DataSource}
 * available, outcomes go to the {@code actionable_outcomes} table, created on startup.
 * Otherwise an in-memory recorder is used, which does not survive a restart.
 */
@Configuration
public class OutcomeRecorderConfig {

    private static final Logger log = LoggerFactory.getLogger(OutcomeRecorderConfig.class);

    @Bean
    public OutcomeRecorder outcomeRecorder(HistoryProperties properties,
                                           ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if ("jdbc".equalsIgnoreCase(properties.getStore()) && ds != null) {
            log.info("Configuring JDBC outcome recorder");
            var recorder = new JdbcOutcomeRecorder(ds);
            recorder.createTables();
            return recorder;
        }
        log.info("Using in-memory outcome recorder (store={}, dataSource={}); history will not persist across restarts",
                properties.getStore(), ds != null ? "present" : "absent");
        return new InMemoryOutcomeRecorder();
    }
}
