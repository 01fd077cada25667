package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SongView {

    String slug;
    String title;
    String artist;
    String description;
    String originalFilename;
    String mimeType;
    long sizeBytes;
    long downloadCount;
    long viewCount;
    Instant createdAt;
    String downloadUrl;
}
