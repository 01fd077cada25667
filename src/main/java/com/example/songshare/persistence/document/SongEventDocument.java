package com.example.songshare.persistence.document;

import com.example.songshare.model.EventType;
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
@Document(collection = "songEvents")
public class SongEventDocument {

    @Id
    private String id;

    @Indexed
    private String slug;

    private String songTitle;
    private EventType eventType;

    @Indexed
    private Instant timestamp;

    private String userAgent;
    private String ipAddress;
    private String referer;
}
