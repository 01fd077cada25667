package com.example.songshare.exception;

public class BlobStorageException extends RuntimeException {

    public BlobStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
