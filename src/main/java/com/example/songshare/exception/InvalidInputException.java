package com.example.songshare.exception;

/**
 * Request rejected before anything was persisted: a required field is
 * missing, a parameter is malformed or the file type is not on the allow-list.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
