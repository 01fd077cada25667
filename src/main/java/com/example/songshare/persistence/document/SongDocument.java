package com.example.songshare.persistence.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "songs")
public class SongDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String slug;

    private String title;
    private String artist;
    private String description;

    /** Blob-store key of the audio bytes. Never leaves the server. */
    private String objectKey;
    private String originalFilename;
    private String mimeType;
    private long sizeBytes;

    @Indexed
    private long downloadCount;
    private long viewCount;

    @Indexed
    private Instant createdAt;
    private Instant updatedAt;
}
