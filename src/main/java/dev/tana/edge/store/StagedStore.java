package dev.tana.edge.store;

import dev.tana.edge.error.EdgeException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Two-layer key-value store: a committed map plus a staging map whose entries shadow it.
 *
 * <p>A staged {@link Optional#empty()} marks a pending delete. Writes are validated per entry
 * before they are staged; the aggregate limits are checked against the merged state when
 * {@link #commit()} runs. Every operation holds the store lock for its whole duration.</p>
 */
public final class StagedStore {
    public static final int MAX_KEY_SIZE = 256;
    public static final int MAX_VALUE_SIZE = 10_240;
    public static final int MAX_TOTAL_SIZE = 102_400;
    public static final int MAX_KEYS = 1000;

    private final Object lock = new Object();
    private final Map<String, String> committed = new HashMap<>();
    private final Map<String, Optional<String>> staging = new HashMap<>();

    public void set(String key, String value) {
        int keySize = byteLength(key);
        if (keySize > MAX_KEY_SIZE) {
            throw EdgeException.validation("Key too large: " + keySize + " bytes (max " + MAX_KEY_SIZE + ")");
        }
        int valueSize = byteLength(value);
        if (valueSize > MAX_VALUE_SIZE) {
            throw EdgeException.validation("Value too large: " + valueSize + " bytes (max " + MAX_VALUE_SIZE + ")");
        }
        synchronized (lock) {
            staging.put(key, Optional.of(value));
        }
    }

    public Optional<String> get(String key) {
        synchronized (lock) {
            Optional<String> staged = staging.get(key);
            if (staged != null) {
                return staged;
            }
            return Optional.ofNullable(committed.get(key));
        }
    }

    public void delete(String key) {
        synchronized (lock) {
            staging.put(key, Optional.empty());
        }
    }

    public boolean has(String key) {
        return get(key).isPresent();
    }

    /**
     * Live keys (committed plus staged writes, minus staged deletes), sorted.
     *
     * @param pattern optional glob where {@code *} matches any run of characters
     */
    public List<String> keys(String pattern) {
        TreeSet<String> live;
        synchronized (lock) {
            live = new TreeSet<>(committed.keySet());
            for (var entry : staging.entrySet()) {
                if (entry.getValue().isPresent()) {
                    live.add(entry.getKey());
                } else {
                    live.remove(entry.getKey());
                }
            }
        }
        if (pattern == null) {
            return new ArrayList<>(live);
        }
        Pattern matcher = globToPattern(pattern);
        List<String> filtered = new ArrayList<>();
        for (String key : live) {
            if (matcher.matcher(key).matches()) {
                filtered.add(key);
            }
        }
        return filtered;
    }

    public Map<String, String> entries() {
        synchronized (lock) {
            Map<String, String> merged = mergedView();
            Map<String, String> sorted = new LinkedHashMap<>();
            new TreeSet<>(merged.keySet()).forEach(key -> sorted.put(key, merged.get(key)));
            return sorted;
        }
    }

    /**
     * Drops committed and staged entries at once.
     */
    public void clear() {
        synchronized (lock) {
            committed.clear();
            staging.clear();
        }
    }

    /**
     * Applies staged writes and deletes, or nothing at all when the merged state would break a limit.
     */
    public void commit() {
        synchronized (lock) {
            Map<String, String> merged = mergedView();
            long totalSize = 0;
            for (var entry : merged.entrySet()) {
                totalSize += byteLength(entry.getKey()) + byteLength(entry.getValue());
            }
            if (totalSize > MAX_TOTAL_SIZE) {
                throw EdgeException.limit("Storage limit exceeded: " + totalSize + " bytes (max " + MAX_TOTAL_SIZE + ")");
            }
            if (merged.size() > MAX_KEYS) {
                throw EdgeException.limit("Too many keys: " + merged.size() + " (max " + MAX_KEYS + ")");
            }
            for (var entry : staging.entrySet()) {
                if (entry.getValue().isPresent()) {
                    committed.put(entry.getKey(), entry.getValue().get());
                } else {
                    committed.remove(entry.getKey());
                }
            }
            staging.clear();
        }
    }

    /**
     * Copy of the committed layer only, ignoring staging.
     */
    public Map<String, String> committedSnapshot() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new HashMap<>(committed));
        }
    }

    public int stagedCount() {
        synchronized (lock) {
            return staging.size();
        }
    }

    private Map<String, String> mergedView() {
        Map<String, String> merged = new HashMap<>(committed);
        for (var entry : staging.entrySet()) {
            if (entry.getValue().isPresent()) {
                merged.put(entry.getKey(), entry.getValue().get());
            } else {
                merged.remove(entry.getKey());
            }
        }
        return merged;
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        for (int i = 0; i < glob.length(); i++) {
            if (glob.charAt(i) == '*') {
                if (i > start) {
                    regex.append(Pattern.quote(glob.substring(start, i)));
                }
                regex.append(".*");
                start = i + 1;
            }
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static int byteLength(String value) {
        return value == null ? 0 : value.getBytes(StandardCharsets.UTF_8).length;
    }
}
