package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnalyticsOverview {

    long totalSongs;
    long totalDownloads;
    long totalViews;
    List<TopSong> topSongs;
    List<RecentEvent> recentEvents;
}
