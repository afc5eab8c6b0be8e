package com.warden.application.ports.impl;

import com.warden.application.ports.MigrationMetadataPort;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dev-only marker store; forgets everything on restart.
 */
public final class InMemoryMigrationMetadataStore implements MigrationMetadataPort {

    private final AtomicBoolean migrated = new AtomicBoolean();

    @Override
    public boolean isMigrated() {
        return migrated.get();
    }

    @Override
    public void markMigrated() {
        migrated.set(true);
    }
}
