package com.example.songshare.service;

import com.example.songshare.config.AsyncConfig;
import com.example.songshare.model.EventType;
import com.example.songshare.model.RequestContext;
import com.example.songshare.persistence.document.SongDocument;
import com.example.songshare.persistence.document.SongEventDocument;
import com.example.songshare.persistence.repository.SongEventRepository;
import com.example.songshare.persistence.repository.SongRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Best-effort analytics for views and downloads.
 *
 * <p>The counter increment and the event insert are attempted independently.
 * Any failure is logged here and never reaches the request that triggered it.
 */
@Component
@RequiredArgsConstructor
public class ActivityRecorder {

    private static final Logger log = LoggerFactory.getLogger(ActivityRecorder.class);

    private final SongRepository songRepository;
    private final SongEventRepository songEventRepository;

    @Async(AsyncConfig.ANALYTICS_EXECUTOR)
    public void record(SongDocument song, EventType eventType, RequestContext context) {
        String slug = song.getSlug();
        try {
            if (!songRepository.incrementCounter(slug, eventType.counter(), 1)) {
                log.warn("No song matched {} while counting {}", slug, eventType.value());
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to increment {} for {}: {}", eventType.counter().field(), slug, ex.getMessage());
        }

        RequestContext ctx = context != null ? context : RequestContext.empty();
        try {
            songEventRepository.insert(SongEventDocument.builder()
                .slug(slug)
                .songTitle(song.getTitle())
                .eventType(eventType)
                .timestamp(Instant.now())
                .userAgent(ctx.getUserAgent())
                .ipAddress(ctx.getIpAddress())
                .referer(ctx.getReferer())
                .build());
        } catch (RuntimeException ex) {
            log.warn("Failed to log {} event for {}: {}", eventType.value(), slug, ex.getMessage());
        }
    }
}
