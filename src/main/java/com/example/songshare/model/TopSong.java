package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TopSong {

    String slug;
    String title;
    String artist;
    long downloadCount;
    long viewCount;
}
