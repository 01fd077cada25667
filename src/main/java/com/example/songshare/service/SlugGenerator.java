package com.example.songshare.service;

import com.example.songshare.config.ShareProperties;
import com.example.songshare.exception.SlugCollisionException;
import com.example.songshare.persistence.repository.SongRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Random;

/**
 * Mints public slugs of the form {@code <readable-base>-<hex-suffix>}, for
 * example {@code midnight-city-m83-3fa91c}.
 *
 * <p>A candidate is checked against the song collection and redrawn on
 * collision, up to {@code app.share.slug-max-attempts} times. Lookup failures
 * propagate to the caller so that no unchecked slug is ever issued.
 */
@Component
public class SlugGenerator {

    static final int MAX_BASE_LENGTH = 48;

    private static final Logger log = LoggerFactory.getLogger(SlugGenerator.class);
    private static final HexFormat HEX = HexFormat.of();

    private final SongRepository songRepository;
    private final ShareProperties props;
    private final Random random;

    @Autowired
    public SlugGenerator(SongRepository songRepository, ShareProperties props) {
        this(songRepository, props, new SecureRandom());
    }

    SlugGenerator(SongRepository songRepository, ShareProperties props, Random random) {
        this.songRepository = songRepository;
        this.props = props;
        this.random = random;
    }

    public String generate(String title, String artist) {
        String base = toBase(title, artist);
        int maxAttempts = Math.max(props.getSlugMaxAttempts(), 1);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = base + "-" + nextSuffix();
            if (!songRepository.existsBySlug(candidate)) {
                return candidate;
            }
            log.debug("Slug {} already taken (attempt {}/{})", candidate, attempt, maxAttempts);
        }
        throw new SlugCollisionException("No free slug for base '" + base + "' after " + maxAttempts + " attempts");
    }

    String toBase(String title, String artist) {
        String raw = (nullToEmpty(title) + " " + nullToEmpty(artist)).trim();
        String ascii = Normalizer.normalize(raw, Normalizer.Form.NFD)
            .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
        String base = ascii.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("(^-+|-+$)", "");
        if (base.length() > MAX_BASE_LENGTH) {
            base = base.substring(0, MAX_BASE_LENGTH).replaceAll("-+$", "");
        }
        return base.isEmpty() ? props.getFallbackBase() : base;
    }

    private String nextSuffix() {
        int length = Math.max(props.getSlugSuffixLength(), 1);
        byte[] buffer = new byte[(length + 1) / 2];
        random.nextBytes(buffer);
        return HEX.formatHex(buffer).substring(0, length);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
