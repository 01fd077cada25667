package com.example.songshare.storage;

import com.example.songshare.config.StorageProperties;
import com.example.songshare.exception.BlobStorageException;
import io.minio.GetObjectArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class MinioBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(MinioBlobStore.class);
    private static final Set<String> MISSING_CODES = Set.of("NoSuchKey", "NoSuchObject");

    private final MinioClient client;
    private final StorageProperties props;

    @Override
    public String store(InputStream in, long size, String originalFilename, String contentType) {
        String objectKey = props.getObjectPrefix() + generateObjectName(originalFilename);
        try {
            client.putObject(PutObjectArgs.builder()
                .bucket(props.getBucketAudio())
                .object(objectKey)
                .stream(in, size, -1)
                .contentType(contentType)
                .userMetadata(Map.of(
                    "original-name", Optional.ofNullable(originalFilename).orElse(objectKey),
                    "uploaded-at", Long.toString(System.currentTimeMillis())
                ))
                .build());
        } catch (Exception ex) {
            throw new BlobStorageException("Failed to store " + objectKey, ex);
        }
        log.debug("Stored {} bytes as {}", size, objectKey);
        return objectKey;
    }

    @Override
    public boolean exists(String objectKey) {
        if (!StringUtils.hasText(objectKey)) {
            return false;
        }
        try {
            client.statObject(StatObjectArgs.builder()
                .bucket(props.getBucketAudio())
                .object(objectKey)
                .build());
            return true;
        } catch (ErrorResponseException ex) {
            if (MISSING_CODES.contains(ex.errorResponse().code())) {
                return false;
            }
            throw new BlobStorageException("Failed to stat " + objectKey, ex);
        } catch (Exception ex) {
            throw new BlobStorageException("Failed to stat " + objectKey, ex);
        }
    }

    @Override
    public InputStream openForRead(String objectKey) {
        try {
            return client.getObject(GetObjectArgs.builder()
                .bucket(props.getBucketAudio())
                .object(objectKey)
                .build());
        } catch (Exception ex) {
            throw new BlobStorageException("Failed to open " + objectKey, ex);
        }
    }

    @Override
    public void delete(String objectKey) {
        try {
            client.removeObject(RemoveObjectArgs.builder()
                .bucket(props.getBucketAudio())
                .object(objectKey)
                .build());
        } catch (Exception ex) {
            throw new BlobStorageException("Failed to delete " + objectKey, ex);
        }
    }

    private String generateObjectName(String originalFilename) {
        String extension = Optional.ofNullable(FilenameUtils.getExtension(Optional.ofNullable(originalFilename).orElse("")))
            .filter(StringUtils::hasText)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .orElse("bin");
        return UUID.randomUUID() + "." + extension;
    }
}
