package com.example.songshare.exception;

/**
 * Every candidate slug drawn within the attempt budget was already taken.
 */
public class SlugCollisionException extends RuntimeException {

    public SlugCollisionException(String message) {
        super(message);
    }
}
