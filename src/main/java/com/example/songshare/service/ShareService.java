package com.example.songshare.service;

import com.example.songshare.config.ShareProperties;
import com.example.songshare.exception.BlobStorageException;
import com.example.songshare.exception.InvalidInputException;
import com.example.songshare.exception.SlugCollisionException;
import com.example.songshare.exception.SongNotFoundException;
import com.example.songshare.model.EventType;
import com.example.songshare.model.RequestContext;
import com.example.songshare.model.SongDownload;
import com.example.songshare.model.SongView;
import com.example.songshare.model.UploadResult;
import com.example.songshare.persistence.document.SongDocument;
import com.example.songshare.persistence.repository.SongRepository;
import com.example.songshare.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ShareService {

    private static final Logger log = LoggerFactory.getLogger(ShareService.class);
    private static final String SONGS_PATH = "/api/songs/";
    private static final String DEFAULT_FILENAME = "audio";
    static final int MAX_RECENT = 200;

    private final SongRepository songRepository;
    private final BlobStore blobStore;
    private final SlugGenerator slugGenerator;
    private final ActivityRecorder activityRecorder;
    private final ShareProperties props;

    /**
     * Stores the file, then the song record. A record is only written once the
     * bytes are durable, and a failed record write removes the stored bytes.
     */
    public UploadResult upload(String title, String artist, String description, MultipartFile file) {
        validate(title, artist, file);

        String originalFilename = Optional.ofNullable(file.getOriginalFilename())
            .map(FilenameUtils::getName)
            .filter(StringUtils::hasText)
            .orElse(DEFAULT_FILENAME);
        String contentType = resolveContentType(file);

        String objectKey;
        try (InputStream in = file.getInputStream()) {
            objectKey = blobStore.store(in, file.getSize(), originalFilename, contentType);
        } catch (IOException ex) {
            throw new BlobStorageException("Failed to read uploaded file", ex);
        }

        SongDocument saved;
        try {
            saved = insertWithFreshSlug(title.trim(), artist.trim(), SongDocument.builder()
                .description(StringUtils.hasText(description) ? description.trim() : null)
                .objectKey(objectKey)
                .originalFilename(originalFilename)
                .mimeType(contentType)
                .sizeBytes(file.getSize()));
        } catch (RuntimeException ex) {
            discardBlob(objectKey);
            throw ex;
        }

        log.info("Uploaded '{}' by '{}' as {} ({} bytes)", saved.getTitle(), saved.getArtist(), saved.getSlug(), saved.getSizeBytes());
        return UploadResult.builder()
            .id(saved.getId())
            .slug(saved.getSlug())
            .downloadUrl(downloadUrl(saved.getSlug()))
            .metaUrl(metaUrl(saved.getSlug()))
            .build();
    }

    public SongView describe(String slug, RequestContext context) {
        SongDocument song = requireSong(slug);
        dispatch(song, EventType.VIEW, context);
        return toView(song);
    }

    public SongDownload download(String slug, RequestContext context) {
        SongDocument song = requireSong(slug);
        if (!blobStore.exists(song.getObjectKey())) {
            log.warn("Song {} exists but its file {} is missing", slug, song.getObjectKey());
            throw new SongNotFoundException("Song not found");
        }

        InputStream stream = blobStore.openForRead(song.getObjectKey());
        dispatch(song, EventType.DOWNLOAD, context);
        return SongDownload.builder()
            .stream(stream)
            .mimeType(Optional.ofNullable(song.getMimeType())
                .filter(StringUtils::hasText)
                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE))
            .filename(Optional.ofNullable(song.getOriginalFilename())
                .filter(StringUtils::hasText)
                .orElseGet(() -> FilenameUtils.getName(song.getObjectKey())))
            .sizeBytes(song.getSizeBytes())
            .build();
    }

    public List<SongView> listRecent(int limit) {
        int safeLimit = Math.min(Math.max(limit, 1), MAX_RECENT);
        return songRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, safeLimit)).stream()
            .map(this::toView)
            .toList();
    }

    private SongDocument insertWithFreshSlug(String title, String artist, SongDocument.SongDocumentBuilder builder) {
        int maxAttempts = Math.max(props.getSlugMaxAttempts(), 1);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String slug = slugGenerator.generate(title, artist);
            Instant now = Instant.now();
            SongDocument document = builder
                .title(title)
                .artist(artist)
                .slug(slug)
                .downloadCount(0)
                .viewCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
            try {
                return songRepository.insert(document);
            } catch (DuplicateKeyException ex) {
                // Another upload claimed the same slug between the check and the insert.
                log.debug("Slug {} taken concurrently (attempt {}/{})", slug, attempt, maxAttempts);
            }
        }
        throw new SlugCollisionException("Could not insert song with a unique slug after " + maxAttempts + " attempts");
    }

    private void validate(String title, String artist, MultipartFile file) {
        if (!StringUtils.hasText(title)) {
            throw new InvalidInputException("title is required");
        }
        if (!StringUtils.hasText(artist)) {
            throw new InvalidInputException("artist is required");
        }
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("file is required");
        }
        if (!isAllowedMimeType(file.getContentType()) && !isAllowedExtension(file.getOriginalFilename())) {
            throw new InvalidInputException("Unsupported audio format");
        }
    }

    private boolean isAllowedMimeType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return false;
        }
        String bare = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return props.getAllowedMimeTypes().contains(bare);
    }

    private boolean isAllowedExtension(String filename) {
        String extension = FilenameUtils.getExtension(Optional.ofNullable(filename).orElse(""));
        return StringUtils.hasText(extension)
            && props.getAllowedExtensions().contains(extension.toLowerCase(Locale.ROOT));
    }

    private String resolveContentType(MultipartFile file) {
        return Optional.ofNullable(file.getContentType())
            .filter(StringUtils::hasText)
            .or(() -> MediaTypeFactory.getMediaType(file.getOriginalFilename()).map(MediaType::toString))
            .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }

    private SongDocument requireSong(String slug) {
        return songRepository.findBySlug(slug)
            .orElseThrow(() -> new SongNotFoundException("Song not found"));
    }

    private void dispatch(SongDocument song, EventType eventType, RequestContext context) {
        try {
            activityRecorder.record(song, eventType, context);
        } catch (RuntimeException ex) {
            log.warn("Could not dispatch {} event for {}: {}", eventType.value(), song.getSlug(), ex.getMessage());
        }
    }

    private void discardBlob(String objectKey) {
        try {
            blobStore.delete(objectKey);
        } catch (RuntimeException ex) {
            log.warn("Failed to remove orphaned file {}: {}", objectKey, ex.getMessage());
        }
    }

    private SongView toView(SongDocument song) {
        return SongView.builder()
            .slug(song.getSlug())
            .title(song.getTitle())
            .artist(song.getArtist())
            .description(song.getDescription())
            .originalFilename(song.getOriginalFilename())
            .mimeType(song.getMimeType())
            .sizeBytes(song.getSizeBytes())
            .downloadCount(song.getDownloadCount())
            .viewCount(song.getViewCount())
            .createdAt(song.getCreatedAt())
            .downloadUrl(downloadUrl(song.getSlug()))
            .build();
    }

    private String metaUrl(String slug) {
        return baseUrl() + SONGS_PATH + slug;
    }

    private String downloadUrl(String slug) {
        return metaUrl(slug) + "/download";
    }

    private String baseUrl() {
        String base = props.getBaseUrl();
        return StringUtils.hasText(base) ? base.trim().replaceAll("/+$", "") : "";
    }
}
