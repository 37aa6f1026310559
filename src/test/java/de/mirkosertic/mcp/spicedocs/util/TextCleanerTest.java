package de.mirkosertic.mcp.spicedocs.util;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    @Test
    void shouldRemoveReplacementCharacter() {
        final String cleaned = TextCleaner.clean("Kernel \uFFFD pool");
        assertThat(cleaned).isEqualTo("Kernel pool");
    }

    @Test
    void shouldRemoveControlCharacters() {
        final String cleaned = TextCleaner.clean("SPK\u0001\u0002\u001Ffile");
        assertThat(cleaned).isEqualTo("SPKfile");
    }

    @Test
    void shouldRemoveZeroWidthCharactersAndBom() {
        final String cleaned = TextCleaner.clean("\uFEFFspk\u200Bez\u200Cr");
        assertThat(cleaned).isEqualTo("spkezr");
    }

    @Test
    void shouldCollapseWhitespaceIncludingLineBreaks() {
        final String cleaned = TextCleaner.clean("  Time\n\n  Required\tReading\u00A0Guide  ");
        assertThat(cleaned).isEqualTo("Time Required Reading Guide");
    }

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(TextCleaner.clean(null)).isEmpty();
        assertThat(TextCleaner.clean("")).isEmpty();
    }

    @Test
    void shouldKeepShortTextWhenTruncating() {
        assertThat(TextCleaner.truncate("short", 200)).isEqualTo("short");
    }

    @Test
    void shouldMarkTruncation() {
        final String text = "a".repeat(250);
        final String truncated = TextCleaner.truncate(text, 200);
        assertThat(truncated).hasSize(203).endsWith("...");
    }
}
