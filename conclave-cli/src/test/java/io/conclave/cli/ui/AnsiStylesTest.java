package io.conclave.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.bold("test");

        assertThat(result).startsWith("\033[1m").contains("test").endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.bold("test")).isEqualTo("test");
        assertThat(styles.arrow()).isEqualTo("→");
        assertThat(styles.separatorTop()).doesNotContain("\033[").startsWith("┌");
    }

    @Test
    void shouldPickColorFromOutcome() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.successOrError("OK", true)).isEqualTo(styles.success("OK"));
        assertThat(styles.successOrError("FAIL", false)).isEqualTo(styles.error("FAIL"));
    }

    @Test
    void shouldReportColorPreference() {
        assertThat(AnsiStyles.of(true).isColorEnabled()).isTrue();
        assertThat(AnsiStyles.of(false).isColorEnabled()).isFalse();
    }
}
