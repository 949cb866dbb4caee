package com.carbonledger.common;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Token-order-insensitive similarity on a 0..100 scale.
 * Both inputs are lower-cased, non-alphanumerics become spaces, tokens are sorted and re-joined, then
 * scored as 100 * 2 * LCS / (len1 + len2) (normalized indel similarity). Blank input scores 0.
 */
public final class TokenSortRatio {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private TokenSortRatio() {
    }

    public static double score(String left, String right) {
        String a = sortedTokens(left);
        String b = sortedTokens(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int lcs = LCS.apply(a, b);
        return 100.0 * (2.0 * lcs) / (a.length() + b.length());
    }

    static String sortedTokens(String value) {
        if (value == null) {
            return "";
        }
        String processed = NON_ALPHANUMERIC.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (processed.isEmpty()) {
            return "";
        }
        return Arrays.stream(WHITESPACE.split(processed))
                .sorted()
                .collect(Collectors.joining(" "));
    }
}
