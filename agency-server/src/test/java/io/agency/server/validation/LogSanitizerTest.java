package io.agency.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void shouldReturnNullStringForNullInput() {
        assertThat(LogSanitizer.sanitize(null)).isEqualTo("null");
    }

    @Test
    void shouldKeepCleanIdentifier() {
        assertThat(LogSanitizer.sanitize("trip-42")).isEqualTo("trip-42");
    }

    @Test
    void shouldStripLineBreaks() {
        assertThat(LogSanitizer.sanitize("wf\r\nINFO forged entry")).isEqualTo("wfINFO forged entry");
    }

    @Test
    void shouldKeepOtherPunctuation() {
        assertThat(LogSanitizer.sanitize("reason: <b>maintenance</b> & restart"))
                .isEqualTo("reason: <b>maintenance</b> & restart");
    }
}
