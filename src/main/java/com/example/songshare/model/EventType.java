package com.example.songshare.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum EventType {

    VIEW(SongCounter.VIEWS),
    DOWNLOAD(SongCounter.DOWNLOADS);

    private final SongCounter counter;

    EventType(SongCounter counter) {
        this.counter = counter;
    }

    /** The per-song counter bumped when this event is recorded. */
    public SongCounter counter() {
        return counter;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EventType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (EventType type : values()) {
            if (type.value().equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
