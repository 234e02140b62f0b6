package com.sentinel.classifier.engine;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts raw transaction descriptions into {@link NormalizedText}.
 *
 * <ol>
 *   <li>NFKC unicode normalization, then lowercase with {@link Locale#ROOT}</li>
 *   <li>apostrophes are dropped so {@code McDonald's} becomes {@code mcdonalds}</li>
 *   <li>every other run of non letter/number characters is a token boundary</li>
 *   <li>purely numeric tokens (amounts, store numbers) are discarded, as are stray
 *   combining marks such as emoji variation selectors</li>
 * </ol>
 *
 * Total for any input, including null.
 *
 * Lowercasing is per character, not full Unicode case folding: {@code STRASSE} and
 * {@code straße} stay distinct tokens, so catalogs list such spellings separately.
 */
public class TextNormalizer {

    private static final Pattern JOINERS = Pattern.compile("['‘’`]");
    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{M}\\p{N}]+");
    private static final Pattern NUMERIC = Pattern.compile("\\p{N}+");
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");

    public NormalizedText normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return NormalizedText.EMPTY;
        }

        String folded = Normalizer.normalize(raw, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        String joined = JOINERS.matcher(folded).replaceAll("");

        List<String> tokens = new ArrayList<>();
        for (String part : SEPARATORS.split(joined)) {
            if (!part.isEmpty() && !NUMERIC.matcher(part).matches() && !MARKS.matcher(part).matches()) {
                tokens.add(part);
            }
        }
        return NormalizedText.of(tokens);
    }
}
