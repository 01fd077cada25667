package com.example.songshare.storage;

import java.io.InputStream;

public interface BlobStore {

    /** Write the bytes under a fresh key and return that key. One writer per key. */
    String store(InputStream in, long size, String originalFilename, String contentType);

    boolean exists(String objectKey);

    InputStream openForRead(String objectKey);

    void delete(String objectKey);
}
