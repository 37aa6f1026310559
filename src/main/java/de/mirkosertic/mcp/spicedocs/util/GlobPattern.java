package de.mirkosertic.mcp.spicedocs.util;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Translates path globs into regular expressions.
 * <p>
 * {@code *} matches any run of characters including {@code /}, {@code ?} matches exactly one character and
 * {@code [...]} matches one character of a class ({@code [!...]} or {@code [^...]} negates it). Matching is
 * case-sensitive and always covers the whole path.
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    /**
     * @return the compiled pattern, or null if {@code glob} is malformed (for example an unclosed class)
     */
    @Nullable
    public static Pattern compile(final String glob) {
        final StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            final char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    final int end = appendCharacterClass(glob, i, regex);
                    if (end < 0) {
                        return null;
                    }
                    i = end;
                }
                default -> appendLiteral(regex, c);
            }
            i++;
        }
        try {
            return Pattern.compile(regex.toString(), Pattern.DOTALL);
        } catch (final PatternSyntaxException e) {
            return null;
        }
    }

    /**
     * @return index of the closing bracket, or -1 if the class is not closed
     */
    private static int appendCharacterClass(final String glob, final int open, final StringBuilder regex) {
        int i = open + 1;
        final StringBuilder cls = new StringBuilder("[");
        if (i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^')) {
            cls.append('^');
            i++;
        }
        // A bracket right after the opening (or the negation) is a literal member
        if (i < glob.length() && glob.charAt(i) == ']') {
            cls.append("\\]");
            i++;
        }
        while (i < glob.length() && glob.charAt(i) != ']') {
            final char c = glob.charAt(i);
            if (c == '-' && cls.length() > 1 && i + 1 < glob.length() && glob.charAt(i + 1) != ']') {
                cls.append('-');
            } else {
                appendLiteral(cls, c);
            }
            i++;
        }
        if (i >= glob.length()) {
            return -1;
        }
        regex.append(cls).append(']');
        return i;
    }

    private static void appendLiteral(final StringBuilder regex, final char c) {
        if (Character.isLetterOrDigit(c)) {
            regex.append(c);
        } else {
            regex.append('\\').append(c);
        }
    }
}
