package com.querybridge.cursor;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * Coordinator address of a remote database, used to build monitoring links.
 *
 * @param scheme http or https
 * @param host coordinator host
 * @param port coordinator port
 */
public record ConnectionMetadata(String scheme, String host, int port) {

    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    /**
     * Derive coordinator metadata from a JDBC URL such as
     * {@code jdbc:trino://coordinator:8443/hive?SSL=true}.
     *
     * @param jdbcUrl JDBC URL
     * @return metadata, empty when the URL has no host
     */
    public static Optional<ConnectionMetadata> fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = new URI(jdbcUrl.substring("jdbc:".length()));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (uri.getHost() == null) {
            return Optional.empty();
        }
        boolean ssl = isSslEnabled(uri.getRawQuery());
        String scheme = ssl ? "https" : "http";
        int port = uri.getPort() > 0 ? uri.getPort() : (ssl ? 443 : 80);
        return Optional.of(new ConnectionMetadata(scheme, uri.getHost(), port));
    }

    private static boolean isSslEnabled(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).toLowerCase(Locale.ROOT);
            if ("ssl".equals(key)) {
                return Boolean.parseBoolean(pair.substring(eq + 1));
            }
        }
        return false;
    }
}
