package com.example.songshare.persistence.repository;

import com.example.songshare.model.EventType;
import com.example.songshare.persistence.document.SongEventDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SongEventRepository extends MongoRepository<SongEventDocument, String> {

    List<SongEventDocument> findByEventTypeOrderByTimestampDesc(EventType eventType, Pageable pageable);

    List<SongEventDocument> findAllByOrderByTimestampDesc(Pageable pageable);
}
