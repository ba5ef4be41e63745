package com.activitytracker.storage;

import com.activitytracker.model.ActivityRecord;

/**
 * The two writes the session merger performs.
 */
public interface ActivityWriter {

    /**
     * @return the generated activity id
     */
    long insert(ActivityRecord record) throws StorageException;

    /**
     * Overwrites the stored duration. Repeating the call with the same value has no further effect.
     */
    void updateDuration(long activityId, int durationSeconds) throws StorageException;
}
