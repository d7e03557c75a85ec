package com.di.userflow.load;

/**
 * What the loader does when a row with the same key already exists.
 */
public enum ConflictPolicy {
    /** Keep the existing row untouched (insert-or-ignore). */
    IGNORE,
    /** Replace the existing row's fields with the staged record (insert-or-update). */
    OVERWRITE
}
