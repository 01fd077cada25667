package com.example.songshare.model;

/**
 * Mutable counters on a song, mapped to their document field.
 */
public enum SongCounter {

    VIEWS("viewCount"),
    DOWNLOADS("downloadCount");

    private final String field;

    SongCounter(String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }
}
