package com.example.songshare.service;

import com.example.songshare.model.StatusReport;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class StatusService {

    private static final Logger log = LoggerFactory.getLogger(StatusService.class);
    private static final int MAX_COLLECTIONS = 10;

    private final MongoTemplate mongoTemplate;
    private final Environment environment;

    public StatusReport check() {
        StatusReport.StatusReportBuilder report = StatusReport.builder()
            .backend("running")
            .databaseUrlConfigured(environment.containsProperty("DATABASE_URL"))
            .collections(List.of());
        try {
            List<String> collections = mongoTemplate.getCollectionNames().stream()
                .sorted()
                .limit(MAX_COLLECTIONS)
                .toList();
            return report
                .database("connected")
                .databaseName(mongoTemplate.getDb().getName())
                .collections(collections)
                .build();
        } catch (DataAccessException ex) {
            log.warn("Database status check failed: {}", ex.getMessage());
            return report.database("unavailable").build();
        }
    }
}
