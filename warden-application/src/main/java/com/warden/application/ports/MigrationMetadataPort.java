package com.warden.application.ports;

/**
 * Durable "bulk encryption migration has completed" marker.
 * The flag only ever moves from unset to set.
 */
public interface MigrationMetadataPort {

    /**
     * @throws StoreAccessException if the marker cannot be read
     */
    boolean isMigrated();

    /**
     * @throws StoreAccessException if the marker cannot be written
     */
    void markMigrated();
}
