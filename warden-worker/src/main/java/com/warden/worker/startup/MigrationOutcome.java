package com.warden.worker.startup;

import com.warden.application.migration.MigrationReport;

import java.time.Instant;

/**
 * What the startup migration did. {@code report} is set for COMPLETED, {@code error}/{@code table} for FAILED.
 */
public record MigrationOutcome(State state, MigrationReport report, String table, String error, Instant at) {

  public enum State {
    /** Startup has not reached the migration step yet. */
    PENDING,
    ENCRYPTION_DISABLED,
    SKIPPED,
    ALREADY_MIGRATED,
    COMPLETED,
    FAILED
  }

  static MigrationOutcome of(State state) {
    return new MigrationOutcome(state, null, null, null, Instant.now());
  }

  static MigrationOutcome completed(MigrationReport report) {
    return new MigrationOutcome(
        report.alreadyMigrated() ? State.ALREADY_MIGRATED : State.COMPLETED, report, null, null, Instant.now());
  }

  static MigrationOutcome failed(String table, String error) {
    return new MigrationOutcome(State.FAILED, null, table, error, Instant.now());
  }
}
