package uz.sonic.continuum.util;

import java.util.Locale;

public final class RepositoryUrls {

    private RepositoryUrls() {
    }

    /**
     * Canonical lookup key: trimmed, lower-cased, without {@code .git} suffix or trailing slash.
     */
    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        return stripSuffixes(url.strip().toLowerCase(Locale.ROOT));
    }

    public static String webUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        return stripSuffixes(url.strip());
    }

    private static String stripSuffixes(String url) {
        String result = url;
        if (result.endsWith(".git")) {
            result = result.substring(0, result.length() - 4);
        }
        if (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
