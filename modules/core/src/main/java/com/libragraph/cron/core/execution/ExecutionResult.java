package com.libragraph.cron.core.execution;

/**
 * Outcome of a successful delegation: the session the execution engine opened for the run.
 */
public record ExecutionResult(String sessionId) {}
