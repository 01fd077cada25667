package com.example.songshare.service;

import com.example.songshare.model.EventType;
import com.example.songshare.model.RequestContext;
import com.example.songshare.model.SongCounter;
import com.example.songshare.persistence.document.SongDocument;
import com.example.songshare.persistence.document.SongEventDocument;
import com.example.songshare.persistence.repository.SongEventRepository;
import com.example.songshare.persistence.repository.SongRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ActivityRecorder")
class ActivityRecorderTest {

    @Mock
    private SongRepository songRepository;

    @Mock
    private SongEventRepository songEventRepository;

    @InjectMocks
    private ActivityRecorder recorder;

    private final SongDocument song = SongDocument.builder().slug("halo-beyonce-abc123").title("Halo").build();

    @Test
    @DisplayName("download bumps the download counter and logs the request details")
    void record_download() {
        when(songRepository.incrementCounter("halo-beyonce-abc123", SongCounter.DOWNLOADS, 1)).thenReturn(true);
        RequestContext context = RequestContext.builder()
            .ipAddress("203.0.113.7")
            .userAgent("Mozilla/5.0")
            .referer("https://example.com/")
            .build();

        recorder.record(song, EventType.DOWNLOAD, context);

        ArgumentCaptor<SongEventDocument> captor = ArgumentCaptor.forClass(SongEventDocument.class);
        verify(songEventRepository).insert(captor.capture());
        SongEventDocument event = captor.getValue();
        assertThat(event.getSlug()).isEqualTo("halo-beyonce-abc123");
        assertThat(event.getSongTitle()).isEqualTo("Halo");
        assertThat(event.getEventType()).isEqualTo(EventType.DOWNLOAD);
        assertThat(event.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(event.getUserAgent()).isEqualTo("Mozilla/5.0");
        assertThat(event.getReferer()).isEqualTo("https://example.com/");
        assertThat(event.getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("view bumps the view counter")
    void record_view() {
        recorder.record(song, EventType.VIEW, null);

        verify(songRepository).incrementCounter("halo-beyonce-abc123", SongCounter.VIEWS, 1);
        verify(songEventRepository).insert(any(SongEventDocument.class));
    }

    @Test
    @DisplayName("a failing event insert is swallowed after the counter is bumped")
    void record_swallowsEventFailure() {
        when(songEventRepository.insert(any(SongEventDocument.class)))
            .thenThrow(new DataAccessResourceFailureException("events down"));

        assertThatCode(() -> recorder.record(song, EventType.DOWNLOAD, RequestContext.empty()))
            .doesNotThrowAnyException();
        verify(songRepository).incrementCounter("halo-beyonce-abc123", SongCounter.DOWNLOADS, 1);
    }

    @Test
    @DisplayName("a failing increment still lets the event be logged")
    void record_swallowsCounterFailure() {
        when(songRepository.incrementCounter("halo-beyonce-abc123", SongCounter.DOWNLOADS, 1))
            .thenThrow(new DataAccessResourceFailureException("songs down"));

        assertThatCode(() -> recorder.record(song, EventType.DOWNLOAD, RequestContext.empty()))
            .doesNotThrowAnyException();
        verify(songEventRepository).insert(any(SongEventDocument.class));
    }
}
