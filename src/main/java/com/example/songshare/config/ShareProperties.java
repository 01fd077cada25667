package com.example.songshare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Settings for public share links and upload acceptance.
 */
@Component
@ConfigurationProperties(prefix = "app.share")
public class ShareProperties {

    /**
     * Prefixed onto download and metadata URLs. Blank keeps them relative.
     */
    private String baseUrl = "";
    private Set<String> allowedMimeTypes = new LinkedHashSet<>(List.of(
        "audio/mpeg", "audio/wav", "audio/x-wav", "audio/flac",
        "audio/aac", "audio/ogg", "audio/mp4", "audio/x-m4a"
    ));
    private Set<String> allowedExtensions = new LinkedHashSet<>(List.of(
        "mp3", "wav", "flac", "aac", "ogg", "m4a", "mp4"
    ));
    private String fallbackBase = "song";
    private int slugSuffixLength = 6;
    private int slugMaxAttempts = 10;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Set<String> getAllowedMimeTypes() {
        return allowedMimeTypes;
    }

    public void setAllowedMimeTypes(Set<String> allowedMimeTypes) {
        this.allowedMimeTypes = allowedMimeTypes;
    }

    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(Set<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    public String getFallbackBase() {
        return fallbackBase;
    }

    public void setFallbackBase(String fallbackBase) {
        this.fallbackBase = fallbackBase;
    }

    public int getSlugSuffixLength() {
        return slugSuffixLength;
    }

    public void setSlugSuffixLength(int slugSuffixLength) {
        this.slugSuffixLength = slugSuffixLength;
    }

    public int getSlugMaxAttempts() {
        return slugMaxAttempts;
    }

    public void setSlugMaxAttempts(int slugMaxAttempts) {
        this.slugMaxAttempts = slugMaxAttempts;
    }
}
