package de.mirkosertic.mcp.spicedocs.util;

import java.util.regex.Pattern;

/**
 * Normalizes text extracted from HTML pages before it is indexed or returned to a caller.
 *
 * <p>Removes characters that only show up as noise in search results:</p>
 * <ul>
 *   <li>Unicode replacement characters (U+FFFD) from failed decoding</li>
 *   <li>Control characters other than whitespace</li>
 *   <li>Zero-width characters and byte order marks</li>
 * </ul>
 * <p>Every run of whitespace, including non-breaking spaces, becomes a single space.</p>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000" +                    // NULL
        "\u0001-\u0008" +             // Control chars before TAB
        "\u000B-\u000C" +             // VT, FF
        "\u000E-\u001F" +             // Control chars after CR
        "\u200B-\u200D" +             // Zero-width space, non-joiner, joiner
        "\uFEFF" +                    // Byte order mark
        "\uFFFD" +                    // Replacement character
        "]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\u00A0]+");

    private TextCleaner() {
    }

    /**
     * Remove invalid characters and collapse whitespace.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or the empty string for null input
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final String withoutInvalid = INVALID_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(withoutInvalid).replaceAll(" ").trim();
    }

    /**
     * Cut {@code text} to at most {@code maxLength} characters, marking the cut with "...".
     */
    public static String truncate(final String text, final int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength)) + "...";
    }
}
