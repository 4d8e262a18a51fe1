package com.docweaver.core.config;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.state.InMemoryTaskStateStore;
import com.docweaver.core.state.JdbcTaskStateStore;
import com.docweaver.core.state.TaskStateStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link TaskStateStore}.
 * <p>
 * When {@code docweaver.store.jdbc-url} is set, a pooled PostgreSQL {@link DataSource} is
 * created and tasks are persisted through {@link JdbcTaskStateStore}. Otherwise tasks are
 * kept in memory, suitable for development and the CLI but not durable across restarts.
 * <p>
 * Instances sharing one database must each set a distinct, stable
 * {@code docweaver.store.instance-id}; a restarted instance fails only its own unfinished tasks.
 */
@Configuration
public class TaskStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskStoreConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnExpression("!'${docweaver.store.jdbc-url:}'.isBlank()")
    public HikariDataSource docweaverDataSource(DocweaverProperties properties) {
        var store = properties.getStore();
        var config = new HikariConfig();
        config.setJdbcUrl(store.getJdbcUrl());
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setPoolName("docweaver-store");
        config.setMaximumPoolSize(10);
        return new HikariDataSource(config);
    }

    @Bean
    public TaskStateStore taskStateStore(PipelineGraph graph, ObjectProvider<DataSource> dataSource,
                                         DocweaverProperties properties) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            String instanceId = properties.getStore().getInstanceId();
            if (instanceId == null || instanceId.isBlank()) {
                instanceId = JdbcTaskStateStore.DEFAULT_OWNER;
            }
            log.info("Configuring JDBC task store (PostgreSQL) for instance '{}'", instanceId);
            var store = new JdbcTaskStateStore(ds, graph, instanceId);
            store.createTables();
            return store;
        }
        log.info("No task database configured; using in-memory task store (tasks will not persist across restarts)");
        return new InMemoryTaskStateStore(graph);
    }
}
