package com.example.songshare.service;

import com.example.songshare.model.AnalyticsOverview;
import com.example.songshare.model.EventType;
import com.example.songshare.model.RecentEvent;
import com.example.songshare.model.SongCounter;
import com.example.songshare.model.TopSong;
import com.example.songshare.persistence.document.SongDocument;
import com.example.songshare.persistence.document.SongEventDocument;
import com.example.songshare.persistence.repository.SongEventRepository;
import com.example.songshare.persistence.repository.SongRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Dashboard rollups. Recomputed from the store on every call.
 */
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    static final int MAX_LIMIT = 100;

    private final SongRepository songRepository;
    private final SongEventRepository songEventRepository;

    /**
     * @param eventType events to list, or {@code null} for every type
     */
    public AnalyticsOverview overview(int limit, EventType eventType) {
        int safeLimit = Math.min(Math.max(limit, 1), MAX_LIMIT);

        Sort topSort = Sort.by(Sort.Direction.DESC, SongCounter.DOWNLOADS.field())
            .and(Sort.by(Sort.Direction.ASC, "createdAt"));
        List<TopSong> topSongs = songRepository.findAll(PageRequest.of(0, safeLimit, topSort)).getContent().stream()
            .map(this::toTopSong)
            .toList();

        Pageable recent = PageRequest.of(0, safeLimit);
        List<SongEventDocument> events = eventType != null
            ? songEventRepository.findByEventTypeOrderByTimestampDesc(eventType, recent)
            : songEventRepository.findAllByOrderByTimestampDesc(recent);

        return AnalyticsOverview.builder()
            .totalSongs(songRepository.count())
            .totalDownloads(songRepository.sumCounter(SongCounter.DOWNLOADS))
            .totalViews(songRepository.sumCounter(SongCounter.VIEWS))
            .topSongs(topSongs)
            .recentEvents(events.stream().map(this::toRecentEvent).toList())
            .build();
    }

    private TopSong toTopSong(SongDocument doc) {
        return TopSong.builder()
            .slug(doc.getSlug())
            .title(doc.getTitle())
            .artist(doc.getArtist())
            .downloadCount(doc.getDownloadCount())
            .viewCount(doc.getViewCount())
            .build();
    }

    private RecentEvent toRecentEvent(SongEventDocument doc) {
        return RecentEvent.builder()
            .slug(doc.getSlug())
            .songTitle(doc.getSongTitle())
            .eventType(doc.getEventType())
            .timestamp(doc.getTimestamp())
            .userAgent(doc.getUserAgent())
            .ipAddress(doc.getIpAddress())
            .referer(doc.getReferer())
            .build();
    }
}
