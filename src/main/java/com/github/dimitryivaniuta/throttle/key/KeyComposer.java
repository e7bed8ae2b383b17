package com.github.dimitryivaniuta.throttle.key;

import com.github.dimitryivaniuta.throttle.exchange.ThrottleRequest;
import com.github.dimitryivaniuta.throttle.store.ExpirableStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the composite key that selects a token bucket.
 *
 * <p>Dimension order is fixed: address, path, method, basic-auth user, then header pairs sorted by header name.
 * Every part carries its dimension tag ({@code addr=}, {@code path=}, {@code method=}, {@code user=},
 * {@code header=name:value}) and client-supplied text is escaped, so a value taken from one dimension can never
 * reproduce a part of another. Parts are joined with {@link #SEPARATOR}.
 *
 * <p>When no dimension is active every request maps to {@link #GLOBAL_KEY}, i.e. a single shared bucket.
 */
public final class KeyComposer {

    public static final char SEPARATOR = '\u001F';
    public static final String GLOBAL_KEY = "\u001Fglobal";

    static final String ADDRESS_TAG = "addr=";
    static final String PATH_TAG = "path=";
    static final String METHOD_TAG = "method=";
    static final String USER_TAG = "user=";
    static final String HEADER_TAG = "header=";

    private final ExpirableStore<String, Boolean> basicAuthUsers;
    private final ExpirableStore<String, Set<String>> headerEntries;

    public KeyComposer(ExpirableStore<String, Boolean> basicAuthUsers,
                       ExpirableStore<String, Set<String>> headerEntries) {
        this.basicAuthUsers = basicAuthUsers;
        this.headerEntries = headerEntries;
    }

    /**
     * @param address resolved limiting address, empty if resolution failed or is disabled
     * @return the key, or empty when the request must bypass limiting (required address missing
     *         and no principal dimension matched)
     */
    public Optional<String> compose(ThrottleRequest request, Optional<String> address, KeyPolicy policy) {
        Optional<String> user = matchedUser(request);
        List<String> headerPairs = matchedHeaders(request);

        if (address.isEmpty() && policy.addressRequired() && user.isEmpty() && headerPairs.isEmpty()) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>();
        address.ifPresent(a -> parts.add(ADDRESS_TAG + escape(a)));
        if (policy.includePath()) parts.add(PATH_TAG + escape(request.path() == null ? "" : request.path()));
        if (policy.includeMethod()) parts.add(METHOD_TAG + escape(request.method().toUpperCase(Locale.ROOT)));
        user.ifPresent(u -> parts.add(USER_TAG + escape(u)));
        parts.addAll(headerPairs);

        return Optional.of(join(parts));
    }

    public static String join(List<String> parts) {
        if (parts.isEmpty()) return GLOBAL_KEY;

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(parts.get(i));
        }
        return sb.toString();
    }

    private Optional<String> matchedUser(ThrottleRequest request) {
        return request.basicAuthUsername()
                .filter(u -> !u.isEmpty())
                .filter(basicAuthUsers::contains);
    }

    private List<String> matchedHeaders(ThrottleRequest request) {
        Map<String, Set<String>> registered = new TreeMap<>(headerEntries.snapshot());
        if (registered.isEmpty()) return List.of();

        List<String> pairs = new ArrayList<>();
        registered.forEach((name, allowed) -> {
            Set<String> seen = new LinkedHashSet<>();
            for (String value : request.headerValues(name)) {
                String v = value.trim();
                if (allowed.contains(v) && seen.add(v)) {
                    pairs.add(HEADER_TAG + escapeHeaderName(name) + ":" + escape(v));
                }
            }
        });
        return pairs;
    }

    /**
     * Percent-escapes the characters that delimit key parts. {@code %} goes first so the mapping stays injective.
     */
    static String escape(String value) {
        if (value.indexOf('%') < 0 && value.indexOf(SEPARATOR) < 0) return value;
        return value.replace("%", "%25").replace(String.valueOf(SEPARATOR), "%1F");
    }

    // the first ':' of a header part ends the name
    private static String escapeHeaderName(String name) {
        return escape(name).replace(":", "%3A");
    }

    /**
     * Header names are case-insensitive; allow-list keys are stored lower-case.
     */
    public static String canonicalHeaderName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
