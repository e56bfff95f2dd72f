package com.datacron.core.registry;

/**
 * What {@link JobRegistry#upsert} did.
 */
public enum UpsertResult {

    /** no job with this id existed in the tenant */
    INSERTED,

    /** an active job was replaced; its pending fire is gone */
    REPLACED_ACTIVE,

    /** an inactive job was replaced */
    REPLACED_INACTIVE
}
