package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RecentEvent {

    String slug;
    String songTitle;
    EventType eventType;
    Instant timestamp;
    String userAgent;
    String ipAddress;
    String referer;
}
