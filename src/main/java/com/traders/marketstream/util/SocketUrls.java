package com.traders.marketstream.util;

import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.regex.Pattern;

public final class SocketUrls {
    private static final Pattern TOKEN_PARAM = Pattern.compile("(?i)(token=)[^&#]*");

    private SocketUrls() {
    }

    /**
     * Joins {@code path} onto {@code baseUrl} unless the path is already an absolute ws(s) URL,
     * and sets the {@code token} query parameter.
     */
    public static URI withToken(String baseUrl, String path, String token) {
        String target = isAbsolute(path) ? path : join(baseUrl, path);
        return UriComponentsBuilder.fromUriString(target)
                .replaceQueryParam("token", token)
                .build()
                .encode()
                .toUri();
    }

    public static String redact(String url) {
        if (url == null) {
            return null;
        }
        return TOKEN_PARAM.matcher(url).replaceAll("$1REDACTED");
    }

    public static String redact(URI uri) {
        return redact(uri.toString());
    }

    private static boolean isAbsolute(String path) {
        return path != null && (path.startsWith("ws://") || path.startsWith("wss://"));
    }

    private static String join(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (path == null || path.isEmpty()) {
            return base;
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }
}
