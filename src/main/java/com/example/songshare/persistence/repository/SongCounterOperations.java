package com.example.songshare.persistence.repository;

import com.example.songshare.model.SongCounter;

/**
 * Counter writes and rollups that must run inside the database rather than
 * as a read-modify-write in the application.
 */
public interface SongCounterOperations {

    /**
     * Atomically adds {@code delta} to the counter of the song with the given
     * slug and refreshes its {@code updatedAt}.
     *
     * @return {@code true} if a song matched the slug
     */
    boolean incrementCounter(String slug, SongCounter counter, long delta);

    /**
     * Sums the counter across all songs; {@code 0} when there are none.
     */
    long sumCounter(SongCounter counter);
}
