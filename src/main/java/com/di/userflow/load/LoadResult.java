package com.di.userflow.load;

/**
 * Outcome of one idempotent load.
 *
 * @param key    destination key (username) that was written
 * @param action what happened to the destination row
 */
public record LoadResult(String key, LoadAction action) {
}
