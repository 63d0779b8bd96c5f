package mta.nzb.checker.service.nzb;

import org.springframework.http.ContentDisposition;

import java.net.URI;
import java.util.Locale;

/**
 * Derives a file name for a downloaded NZB: Content-Disposition first,
 * then the last URL path segment, then a sanitized release title.
 */
public final class NzbFileNames {

    static final String FALLBACK_NAME = "novastream";
    private static final String EXTENSION = ".nzb";

    private NzbFileNames() {}

    public static String derive(String contentDisposition, String url, String title) {
        String fromHeader = fromContentDisposition(contentDisposition);
        if (fromHeader != null) {
            return ensureExtension(fromHeader);
        }

        String fromUrl = fromUrlPath(url);
        if (fromUrl != null) {
            return ensureExtension(fromUrl);
        }

        String fromTitle = sanitizeTitle(title);
        if (!fromTitle.isEmpty()) {
            return ensureExtension(fromTitle);
        }

        return ensureExtension(FALLBACK_NAME);
    }

    static String ensureExtension(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(EXTENSION) ? name : name + EXTENSION;
    }

    /**
     * Spaces become dots; anything outside [A-Za-z0-9._-] is dropped.
     */
    static String sanitizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String trimmed = title.trim();
        StringBuilder safe = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == ' ') {
                safe.append('.');
            } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '-' || c == '_') {
                safe.append(c);
            }
        }
        return safe.toString();
    }

    private static String fromContentDisposition(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        if (value.toLowerCase(Locale.ROOT).startsWith("filename")) {
            // indexers sometimes send the parameter without a disposition type
            value = "attachment; " + value;
        }
        try {
            String name = ContentDisposition.parse(value).getFilename();
            return (name == null || name.isBlank()) ? null : name.trim();
        } catch (IllegalArgumentException e) {
            // unparseable header, fall back to the URL
            return null;
        }
    }

    private static String fromUrlPath(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (path == null || path.isEmpty()) {
            return null;
        }
        String last = path.substring(path.lastIndexOf('/') + 1);
        return last.isEmpty() ? null : last;
    }
}
