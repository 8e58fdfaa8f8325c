package com.example.filefinder;

/**
 * Case-insensitive, anchored glob matching over file names.
 * <p>
 * {@code *} matches any run of zero or more characters, {@code ?} matches exactly one
 * character and every other character matches itself. Matching works on code points, so a
 * supplementary character counts as a single character for {@code ?}.
 */
public final class GlobMatcher {
    private static final int ANY_RUN = '*';
    private static final int ANY_ONE = '?';

    private GlobMatcher() {
    }

    public static boolean matches(String name, String pattern) {
        int[] text = fold(name);
        int[] glob = fold(pattern);

        int t = 0;
        int g = 0;
        // Backtrack checkpoint: last '*' seen and the text position it currently absorbs up to.
        int star = -1;
        int starText = 0;

        while (t < text.length) {
            if (g < glob.length && (glob[g] == ANY_ONE || (glob[g] != ANY_RUN && glob[g] == text[t]))) {
                t++;
                g++;
            } else if (g < glob.length && glob[g] == ANY_RUN) {
                star = g;
                starText = t;
                g++;
            } else if (star >= 0) {
                g = star + 1;
                starText++;
                t = starText;
            } else {
                return false;
            }
        }
        while (g < glob.length && glob[g] == ANY_RUN) {
            g++;
        }
        return g == glob.length;
    }

    /**
     * Returns true if the pattern uses at least one wildcard character.
     */
    public static boolean hasWildcards(String pattern) {
        return pattern.indexOf(ANY_RUN) >= 0 || pattern.indexOf(ANY_ONE) >= 0;
    }

    private static int[] fold(String value) {
        return value.codePoints()
                .map(cp -> Character.toLowerCase(Character.toUpperCase(cp)))
                .toArray();
    }
}
