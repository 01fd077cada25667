package com.example.songshare.service;

import com.example.songshare.model.StatusReport;
import com.mongodb.client.MongoDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatusService")
class StatusServiceTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private Environment environment;

    @InjectMocks
    private StatusService statusService;

    @Test
    @DisplayName("lists collections in name order when the database answers")
    void check_connected() {
        MongoDatabase db = mock(MongoDatabase.class);
        when(db.getName()).thenReturn("songshare");
        when(mongoTemplate.getDb()).thenReturn(db);
        when(mongoTemplate.getCollectionNames()).thenReturn(Set.of("songs", "songEvents"));
        when(environment.containsProperty("DATABASE_URL")).thenReturn(true);

        StatusReport report = statusService.check();

        assertThat(report.getBackend()).isEqualTo("running");
        assertThat(report.getDatabase()).isEqualTo("connected");
        assertThat(report.getDatabaseName()).isEqualTo("songshare");
        assertThat(report.isDatabaseUrlConfigured()).isTrue();
        assertThat(report.getCollections()).containsExactly("songEvents", "songs");
    }

    @Test
    @DisplayName("reports the database as unavailable instead of failing")
    void check_unavailable() {
        when(mongoTemplate.getCollectionNames())
            .thenThrow(new DataAccessResourceFailureException("Timed out"));

        StatusReport report = statusService.check();

        assertThat(report.getBackend()).isEqualTo("running");
        assertThat(report.getDatabase()).isEqualTo("unavailable");
        assertThat(report.isDatabaseUrlConfigured()).isFalse();
        assertThat(report.getCollections()).isEmpty();
    }
}
