package org.smileyface.docexplorer.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public class UrlUtils {

    private UrlUtils() {
        // No instanciation
    }

    /**
     * Parses an absolute http(s) URL. Returns null when the input is blank, malformed, relative,
     * uses another scheme or has no host.
     */
    public static URI parseHttpUrl(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = new URI(raw.trim());
            if (!isHttp(uri) || uri.getHost() == null || uri.getHost().isBlank()) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttp(URI uri) {
        if (uri == null || uri.getScheme() == null) return false;
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("http") || scheme.equals("https");
    }

    /**
     * Canonical form used for visited-set membership: lower-case scheme and host, default port
     * and fragment removed, empty path resolved to "/". Returns null for non-http(s) input.
     */
    public static String normalize(URI uri) {
        if (!isHttp(uri)) return null;
        String host = uri.getHost();
        if (host == null) return null;
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath();
        if (path == null || path.isBlank()) path = "/";
        String query = uri.getRawQuery();

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1 && uri.getPort() != defaultPort(scheme)) {
            sb.append(':').append(uri.getPort());
        }
        sb.append(path);
        if (query != null && !query.isBlank()) sb.append('?').append(query);
        return sb.toString();
    }

    /**
     * Returns the URI without its fragment, which never changes what a server returns.
     */
    public static URI withoutFragment(URI uri) {
        if (uri == null || uri.getRawFragment() == null) return uri;
        String s = uri.toString();
        return URI.create(s.substring(0, s.indexOf('#')));
    }

    /**
     * True when both URIs carry the same host name, ignoring case. Ports and schemes are not compared.
     */
    public static boolean isSameHost(URI a, URI b) {
        if (a == null || b == null || a.getHost() == null || b.getHost() == null) return false;
        return a.getHost().equalsIgnoreCase(b.getHost());
    }

    /**
     * Derives a readable title from the last path segment: "getting-started_guide.html" becomes
     * "getting started guide", "apiReference" becomes "api Reference". Returns null when the path
     * has no segment.
     */
    public static String titleFromPath(URI uri) {
        if (uri == null || uri.getPath() == null) return null;
        String[] segments = uri.getPath().split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            String segment = segments[i];
            if (segment.isBlank()) continue;
            String title = segment
                    .replaceAll("[_-]", " ")
                    .replaceAll("\\.\\w+$", "")
                    .replaceAll("([a-z])([A-Z])", "$1 $2")
                    .trim();
            return title.isEmpty() ? null : title;
        }
        return null;
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
