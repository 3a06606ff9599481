package com.dashquery.dashboard;

import com.dashquery.exception.DashboardParseException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A dashboard link: uid, optional time range and variable bindings.
 * <p>
 * Example: {@code https://host/d/abc123/sales?from=now-24h&to=now&var-region=eu&var-region=us}
 *
 * @param uid       Dashboard uid
 * @param from      Time range start, or null
 * @param to        Time range end, or null
 * @param variables Values from {@code var-<name>} parameters, in order of appearance
 */
public record DashboardUrl(String uid, String from, String to, Map<String, List<String>> variables) {

    private static final Pattern UID_PATTERN = Pattern.compile("/d/([^/?#]+)");
    private static final String VARIABLE_PREFIX = "var-";

    public DashboardUrl {
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Parse a dashboard URL.
     *
     * @throws DashboardParseException if the URL is malformed or has no /d/&lt;uid&gt; segment
     */
    public static DashboardUrl parse(String url) {
        if (url == null || url.isBlank()) {
            throw new DashboardParseException("Dashboard URL is empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new DashboardParseException("Malformed dashboard URL: " + url, e);
        }

        Matcher matcher = UID_PATTERN.matcher(uri.getRawPath() == null ? "" : uri.getRawPath());
        if (!matcher.find()) {
            throw new DashboardParseException("No dashboard uid in URL: " + url);
        }
        String uid = decode(matcher.group(1));

        String from = null;
        String to = null;
        Map<String, List<String>> variables = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query != null) {
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = decode(eq < 0 ? pair : pair.substring(0, eq));
                String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
                if (key.equals("from")) {
                    from = value;
                } else if (key.equals("to")) {
                    to = value;
                } else if (key.startsWith(VARIABLE_PREFIX) && key.length() > VARIABLE_PREFIX.length()) {
                    variables.computeIfAbsent(key.substring(VARIABLE_PREFIX.length()), k -> new ArrayList<>())
                            .add(value);
                }
            }
        }
        variables.replaceAll((k, v) -> List.copyOf(v));
        return new DashboardUrl(uid, from, to, variables);
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new DashboardParseException("Malformed escape in dashboard URL component: " + value, e);
        }
    }
}
