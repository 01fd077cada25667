package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

import java.io.InputStream;

@Value
@Builder
public class SongDownload {

    InputStream stream;
    String mimeType;
    String filename;
    long sizeBytes;
}
