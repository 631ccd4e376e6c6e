package com.libragraph.cron.core.dao;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

/**
 * Connectivity probe and idempotent schema bootstrap for the job store.
 */
public interface SchemaDao {

    String SCHEMA = """
            CREATE TABLE IF NOT EXISTS cron_jobs (
                id                 VARCHAR(64)  PRIMARY KEY,
                name               VARCHAR(255) NOT NULL,
                description        VARCHAR,
                scope              VARCHAR(255) NOT NULL,
                schedule           VARCHAR(255) NOT NULL,
                timezone           VARCHAR(64),
                task_prompt        VARCHAR      NOT NULL,
                task_context       VARCHAR,
                execution_mode     VARCHAR(16)  NOT NULL DEFAULT 'isolated',
                model              VARCHAR(255),
                timeout_ms         BIGINT,
                max_retries        INTEGER      NOT NULL DEFAULT 0,
                linked_schedule_id VARCHAR(255),
                status             VARCHAR(16)  NOT NULL DEFAULT 'active',
                last_run_at        TIMESTAMP WITH TIME ZONE,
                last_run_status    VARCHAR(16),
                next_run_at        TIMESTAMP WITH TIME ZONE,
                run_count          INTEGER      NOT NULL DEFAULT 0,
                created_at         TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at         TIMESTAMP WITH TIME ZONE NOT NULL,
                CHECK (status IN ('active', 'paused', 'completed')),
                CHECK (execution_mode IN ('isolated', 'main'))
            );
            CREATE INDEX IF NOT EXISTS idx_cron_jobs_scope ON cron_jobs (scope);
            CREATE INDEX IF NOT EXISTS idx_cron_jobs_status ON cron_jobs (status);
            CREATE TABLE IF NOT EXISTS cron_run_log (
                id          VARCHAR(64) PRIMARY KEY,
                job_id      VARCHAR(64) NOT NULL REFERENCES cron_jobs (id) ON DELETE CASCADE,
                session_id  VARCHAR(255),
                status      VARCHAR(16) NOT NULL DEFAULT 'running',
                started_at  TIMESTAMP WITH TIME ZONE NOT NULL,
                finished_at TIMESTAMP WITH TIME ZONE,
                error       VARCHAR,
                duration_ms BIGINT,
                CHECK (status IN ('running', 'succeeded', 'failed', 'timeout'))
            );
            CREATE INDEX IF NOT EXISTS idx_cron_run_log_job ON cron_run_log (job_id);
            CREATE INDEX IF NOT EXISTS idx_cron_run_log_started ON cron_run_log (started_at);
            """;

    @SqlQuery("SELECT 1")
    int ping();

    default void createSchema(Handle handle) {
        handle.createScript(SCHEMA).execute();
    }
}
