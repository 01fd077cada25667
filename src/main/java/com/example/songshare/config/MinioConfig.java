package com.example.songshare.config;

import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MinioConfig {

    private static final Logger log = LoggerFactory.getLogger(MinioConfig.class);

    @Bean
    public MinioClient minioClient(StorageProperties properties) throws Exception {
        MinioClient.Builder builder = MinioClient.builder()
            .endpoint(properties.getEndpoint())
            .credentials(properties.getAccessKey(), properties.getSecretKey());
        if (hasRegion(properties)) {
            builder.region(properties.getRegion());
        }
        MinioClient client = builder.build();

        ensureBucket(client, properties);
        return client;
    }

    private void ensureBucket(MinioClient client, StorageProperties properties) throws Exception {
        String bucket = properties.getBucketAudio();
        if (client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
            return;
        }
        log.info("Creating MinIO bucket {}", bucket);
        MakeBucketArgs.Builder builder = MakeBucketArgs.builder().bucket(bucket);
        if (hasRegion(properties)) {
            builder.region(properties.getRegion());
        }
        client.makeBucket(builder.build());
    }

    private boolean hasRegion(StorageProperties properties) {
        return properties.getRegion() != null && !properties.getRegion().isBlank();
    }
}
