package org.poridhi.api.impl;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Form-urlencoded query parsing and percent-decoding.
 * <p>
 * Pairs are split on {@code &}; pairs without {@code =} or with an empty value are skipped.
 * Keys keep first-seen order.
 */
public final class QueryStringParser {

    private QueryStringParser() {}

    /** Every value per key, in arrival order. */
    public static Map<String, List<String>> parseMulti(String queryString) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (queryString == null || queryString.isEmpty()) return out;

        for (String pair : queryString.split("&")) {
            int eq = pair.indexOf('=');
            if (eq < 0) continue;
            String value = pair.substring(eq + 1);
            if (value.isEmpty()) continue;
            String key = decode(pair.substring(0, eq), true);
            out.computeIfAbsent(key, k -> new ArrayList<>()).add(decode(value, true));
        }
        return out;
    }

    /**
     * Flattened view: single values become a {@code String}, repeated keys
     * stay an unmodifiable {@code List<String>}.
     */
    public static Map<String, Object> flatten(Map<String, List<String>> multi) {
        Map<String, Object> out = new LinkedHashMap<>();
        multi.forEach((k, v) -> out.put(k, v.size() == 1 ? v.get(0) : Collections.unmodifiableList(v)));
        return Collections.unmodifiableMap(out);
    }

    public static Map<String, Object> parse(String queryString) {
        return flatten(parseMulti(queryString));
    }

    /**
     * Percent-decodes {@code s} as UTF-8. Invalid escapes are kept as they are;
     * with {@code plusAsSpace} a {@code +} becomes a space (query components, not paths).
     */
    public static String decode(String s, boolean plusAsSpace) {
        if (s.indexOf('%') < 0 && (!plusAsSpace || s.indexOf('+') < 0)) return s;

        ByteArrayOutputStream buf = new ByteArrayOutputStream(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                buf.write(Integer.parseInt(s.substring(i + 1, i + 3), 16));
                i += 3;
            } else if (c == '+' && plusAsSpace) {
                buf.write(' ');
                i++;
            } else {
                byte[] raw = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                if (Character.isHighSurrogate(c) && i + 1 < s.length()) {
                    raw = s.substring(i, i + 2).getBytes(StandardCharsets.UTF_8);
                    i++;
                }
                buf.write(raw, 0, raw.length);
                i++;
            }
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
