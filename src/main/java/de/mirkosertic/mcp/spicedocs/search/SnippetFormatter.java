package de.mirkosertic.mcp.spicedocs.search;

import org.apache.lucene.search.uhighlight.Passage;
import org.apache.lucene.search.uhighlight.PassageFormatter;

/**
 * Joins the passages chosen by the highlighter into one snippet, marking matched terms with
 * {@code <mark>...</mark>} and cut boundaries with {@code ...}.
 */
class SnippetFormatter extends PassageFormatter {

    static final String PRE_TAG = "<mark>";
    static final String POST_TAG = "</mark>";
    static final String ELLIPSIS = "...";

    @Override
    public Object format(final Passage[] passages, final String content) {
        final StringBuilder sb = new StringBuilder();
        int previousEnd = -1;
        for (final Passage passage : passages) {
            if (passage.getStartOffset() > 0 && passage.getStartOffset() != previousEnd) {
                sb.append(ELLIPSIS);
            }
            appendPassage(sb, passage, content);
            previousEnd = passage.getEndOffset();
        }
        if (previousEnd >= 0 && previousEnd < content.length()) {
            sb.append(ELLIPSIS);
        }
        return sb.toString();
    }

    private static void appendPassage(final StringBuilder sb, final Passage passage, final String content) {
        int pos = passage.getStartOffset();
        for (int i = 0; i < passage.getNumMatches(); i++) {
            final int start = passage.getMatchStarts()[i];
            final int end = passage.getMatchEnds()[i];
            // Overlapping matches: only emit the part not written yet
            if (start > pos) {
                sb.append(content, pos, start);
            }
            if (end > pos) {
                sb.append(PRE_TAG);
                sb.append(content, Math.max(pos, start), end);
                sb.append(POST_TAG);
                pos = end;
            }
        }
        if (passage.getEndOffset() > pos) {
            sb.append(content, pos, passage.getEndOffset());
        }
    }
}
