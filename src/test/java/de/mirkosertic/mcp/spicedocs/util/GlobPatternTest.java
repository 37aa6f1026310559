package de.mirkosertic.mcp.spicedocs.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Glob pattern translation")
class GlobPatternTest {

    private static boolean matches(final String glob, final String path) {
        final Pattern pattern = GlobPattern.compile(glob);
        assertThat(pattern).as("glob %s should compile", glob).isNotNull();
        return pattern.matcher(path).matches();
    }

    @Test
    @DisplayName("Star should cross directory separators")
    void starShouldCrossDirectories() {
        assertThat(matches("cspice/*", "cspice/spkezr_c.html")).isTrue();
        assertThat(matches("cspice/*", "cspice/sub/dir.html")).isTrue();
        assertThat(matches("*spk*", "req/spk.html")).isTrue();
        assertThat(matches("*.html", "index.htm")).isFalse();
    }

    @Test
    @DisplayName("Question mark should match exactly one character")
    void questionMarkShouldMatchOneCharacter() {
        assertThat(matches("page_?.html", "page_a.html")).isTrue();
        assertThat(matches("page_?.html", "page_ab.html")).isFalse();
    }

    @Test
    @DisplayName("Character classes should support ranges and negation")
    void shouldSupportCharacterClasses() {
        assertThat(matches("[a-c]*.html", "bodn_c.html")).isTrue();
        assertThat(matches("[a-c]*.html", "ckgp_c.html")).isTrue();
        assertThat(matches("[a-c]*.html", "dafopr_c.html")).isFalse();
        assertThat(matches("[!a-c]*.html", "dafopr_c.html")).isTrue();
        assertThat(matches("[^a-c]*.html", "bodn_c.html")).isFalse();
        assertThat(matches("[]x]y", "]y")).isTrue();
        assertThat(matches("[d]", "d")).isTrue();
    }

    @Test
    @DisplayName("Regex metacharacters should be literal")
    void shouldTreatRegexMetacharactersLiterally() {
        assertThat(matches("a.b", "a.b")).isTrue();
        assertThat(matches("a.b", "axb")).isFalse();
        assertThat(matches("(x)+{1}$", "(x)+{1}$")).isTrue();
        assertThat(matches("back\\slash", "back\\slash")).isTrue();
    }

    @Test
    @DisplayName("Matching should be case-sensitive and anchored")
    void shouldBeCaseSensitiveAndAnchored() {
        assertThat(matches("*.HTML", "index.html")).isFalse();
        assertThat(matches("index", "index.html")).isFalse();
    }

    @Test
    @DisplayName("Unclosed character class should not compile")
    void unclosedClassShouldNotCompile() {
        assertThat(GlobPattern.compile("[abc")).isNull();
        assertThat(GlobPattern.compile("[")).isNull();
    }
}
