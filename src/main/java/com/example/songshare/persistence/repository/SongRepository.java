package com.example.songshare.persistence.repository;

import com.example.songshare.persistence.document.SongDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface SongRepository extends MongoRepository<SongDocument, String>, SongCounterOperations {

    Optional<SongDocument> findBySlug(String slug);

    boolean existsBySlug(String slug);

    List<SongDocument> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
