package io.brainrunr.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits text into overlapping character bigrams, which works for both space-delimited
 * and unsegmented scripts.
 *
 * <p>Text is lowercased and cut at every character that is not a letter or digit. Each
 * segment of two or more code points yields its bigrams; a one-code-point segment yields itself.</p>
 */
public final class BigramTokenizer {

    private BigramTokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        int[] codePoints = text.toLowerCase(Locale.ROOT).codePoints().toArray();
        int start = 0;
        for (int i = 0; i <= codePoints.length; i++) {
            if (i == codePoints.length || !Character.isLetterOrDigit(codePoints[i])) {
                emitSegment(codePoints, start, i, tokens);
                start = i + 1;
            }
        }
        return tokens;
    }

    private static void emitSegment(int[] codePoints, int from, int to, List<String> out) {
        int length = to - from;
        if (length == 1) {
            out.add(new String(codePoints, from, 1));
            return;
        }
        for (int i = from; i + 1 < to; i++) {
            out.add(new String(codePoints, i, 2));
        }
    }
}
