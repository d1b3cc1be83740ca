package netops.gateway.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat key/value view of a gateway INI file. Section headers are folded into the key
 * ({@code [services] pihole = ...} becomes {@code services.pihole}).
 */
public class IniConfig {

    private final Map<String, String> values = new LinkedHashMap<>();

    void put(String key, String value) {
        values.put(key, value);
    }

    public Optional<String> get(String key) {
        String v = values.get(key.toLowerCase());
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
    }

    public Optional<Integer> getInt(String key) {
        return get(key).map(v -> {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an integer for '" + key + "': " + v, e);
            }
        });
    }

    public Optional<Boolean> getBoolean(String key) {
        return get(key).map(v -> "true".equalsIgnoreCase(v) || "yes".equalsIgnoreCase(v) || "1".equals(v));
    }

    /** All entries under {@code section.}, keyed by the remainder of the key */
    public Map<String, String> section(String section) {
        String prefix = section.toLowerCase() + ".";
        Map<String, String> out = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k.startsWith(prefix)) {
                out.put(k.substring(prefix.length()), v);
            }
        });
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        return values.size();
    }
}
