package com.example.songshare.service;

import com.example.songshare.config.ShareProperties;
import com.example.songshare.exception.SlugCollisionException;
import com.example.songshare.persistence.repository.SongRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlugGenerator")
class SlugGeneratorTest {

    @Mock
    private SongRepository songRepository;

    private ShareProperties props;

    @BeforeEach
    void setUp() {
        props = new ShareProperties();
    }

    @Test
    @DisplayName("base is lowercased, separated by single dashes and trimmed")
    void toBase_normalizesTitleAndArtist() {
        SlugGenerator generator = new SlugGenerator(songRepository, props, new Random(1));

        assertThat(generator.toBase("  Midnight City!! ", "M83")).isEqualTo("midnight-city-m83");
        assertThat(generator.toBase("Beyoncé -- Halo", "B & C")).isEqualTo("beyonce-halo-b-c");
    }

    @Test
    @DisplayName("falls back to the default base when nothing alphanumeric remains")
    void toBase_fallsBackWhenEmpty() {
        SlugGenerator generator = new SlugGenerator(songRepository, props, new Random(1));

        assertThat(generator.toBase("!!!", "???")).isEqualTo("song");
        assertThat(generator.toBase(null, null)).isEqualTo("song");
    }

    @Test
    @DisplayName("long bases are cut without leaving a trailing dash")
    void toBase_truncatesLongInput() {
        SlugGenerator generator = new SlugGenerator(songRepository, props, new Random(1));

        String base = generator.toBase("a".repeat(47) + " bcdef", "artist");

        assertThat(base).hasSizeLessThanOrEqualTo(SlugGenerator.MAX_BASE_LENGTH);
        assertThat(base).doesNotEndWith("-");
    }

    @Test
    @DisplayName("same input and same random source give the same slug")
    void generate_isDeterministicForFixedRandomness() {
        when(songRepository.existsBySlug(anyString())).thenReturn(false);

        String first = new SlugGenerator(songRepository, props, new Random(42)).generate("Halo", "Beyonce");
        String second = new SlugGenerator(songRepository, props, new Random(42)).generate("Halo", "Beyonce");

        assertThat(first).isEqualTo(second).matches("halo-beyonce-[0-9a-f]{6}");
    }

    @Test
    @DisplayName("a different random source keeps the base and changes the suffix")
    void generate_differentRandomnessSameBase() {
        when(songRepository.existsBySlug(anyString())).thenReturn(false);

        String first = new SlugGenerator(songRepository, props, new Random(1)).generate("Halo", "Beyonce");
        String second = new SlugGenerator(songRepository, props, new Random(2)).generate("Halo", "Beyonce");

        assertThat(first).startsWith("halo-beyonce-");
        assertThat(second).startsWith("halo-beyonce-");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("draws a new suffix when the candidate is taken")
    void generate_retriesOnCollision() {
        when(songRepository.existsBySlug(anyString())).thenReturn(true, true, false);

        String slug = new SlugGenerator(songRepository, props, new Random(3)).generate("Halo", "Beyonce");

        assertThat(slug).startsWith("halo-beyonce-");
        verify(songRepository, times(3)).existsBySlug(anyString());
    }

    @Test
    @DisplayName("gives up after the configured number of attempts")
    void generate_throwsWhenAttemptsExhausted() {
        props.setSlugMaxAttempts(4);
        when(songRepository.existsBySlug(anyString())).thenReturn(true);

        SlugGenerator generator = new SlugGenerator(songRepository, props, new Random(3));

        assertThatThrownBy(() -> generator.generate("Halo", "Beyonce"))
            .isInstanceOf(SlugCollisionException.class)
            .hasMessageContaining("halo-beyonce");
        verify(songRepository, times(4)).existsBySlug(anyString());
    }

    @Test
    @DisplayName("store failures during the existence check propagate")
    void generate_propagatesStoreFailure() {
        when(songRepository.existsBySlug(anyString()))
            .thenThrow(new DataAccessResourceFailureException("mongo down"));

        SlugGenerator generator = new SlugGenerator(songRepository, props, new Random(3));

        assertThatThrownBy(() -> generator.generate("Halo", "Beyonce"))
            .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("suffix length follows configuration")
    void generate_honoursSuffixLength() {
        props.setSlugSuffixLength(9);
        when(songRepository.existsBySlug(anyString())).thenReturn(false);

        String slug = new SlugGenerator(songRepository, props, new Random(5)).generate("x", "y");

        assertThat(slug).matches("x-y-[0-9a-f]{9}");
    }
}
