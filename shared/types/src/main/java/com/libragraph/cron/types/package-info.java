/**
 * Pure Java value types shared across all cron modules.
 *
 * <p>Every enum is persisted by its lowercase {@code label()}. No framework dependencies.
 */
package com.libragraph.cron.types;
