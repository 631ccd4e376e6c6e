package com.libragraph.cron.core.execution;

import java.util.concurrent.CompletionStage;

/**
 * Runs the task of a fired job. Implemented by the host platform; provide it as a CDI bean
 * or hand it to {@code CronJobManager.init} directly.
 *
 * <p>The returned stage completes with the session id once the run settles, or completes
 * exceptionally if it fails. A {@link java.util.concurrent.TimeoutException} cause is recorded
 * as a timeout rather than a plain failure.
 */
public interface ExecutionEngine {

    CompletionStage<ExecutionResult> trigger(ExecutionContext context);
}
