package utilities;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class BloomLoggerTest {

    @Test
    void shouldParseLevelNames() {
        assertThat(BloomLogger.parseLevel("fine", Level.INFO)).isEqualTo(Level.FINE);
        assertThat(BloomLogger.parseLevel(" WARNING ", Level.INFO)).isEqualTo(Level.WARNING);
        assertThat(BloomLogger.parseLevel("800", Level.FINE)).isEqualTo(Level.INFO);
    }

    @Test
    void shouldFallBackOnMissingOrUnknownLevel() {
        assertThat(BloomLogger.parseLevel(null, Level.INFO)).isEqualTo(Level.INFO);
        assertThat(BloomLogger.parseLevel("  ", Level.SEVERE)).isEqualTo(Level.SEVERE);
        assertThat(BloomLogger.parseLevel("loud", Level.INFO)).isEqualTo(Level.INFO);
    }

    @Test
    void shouldLogAtEveryLevel() {
        assertThatCode(() -> {
            BloomLogger.info("info");
            BloomLogger.warning("warning", new IllegalStateException("boom"));
            BloomLogger.error("error");
            BloomLogger.debug("debug");
            BloomLogger.trace("trace");
        }).doesNotThrowAnyException();
        assertThat(BloomLogger.isDebugEnabled()).isFalse();
    }
}
