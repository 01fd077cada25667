package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UploadResult {

    String id;
    String slug;
    String downloadUrl;
    String metaUrl;
}
