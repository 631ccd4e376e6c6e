/**
 * Shared utilities for all cron modules.
 *
 * <p>Contains {@link com.libragraph.cron.util.JobSchedule}, the parser for the
 * {@code once:<ISO-8601>} schedule literal. No framework dependencies, pure Java.
 */
package com.libragraph.cron.util;
