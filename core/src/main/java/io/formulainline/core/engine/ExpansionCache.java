package io.formulainline.core.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expanded body text per formula name for one engine run. Entries are written once and never
 * replaced; if two threads expand the same formula the first write wins and both see that text.
 */
public final class ExpansionCache {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    /**
     * Returns the cached expansion of a formula.
     *
     * @param name the formula name
     * @return the cached text, or {@code null} if the formula has not been expanded yet
     */
    public String get(String name) {
        return entries.get(name);
    }

    /**
     * Stores {@code text} unless an entry already exists.
     *
     * @param name the formula name
     * @param text the freshly expanded text
     * @return whichever text is now cached, which is the earlier entry if there was one
     */
    public String putIfAbsent(String name, String text) {
        String existing = entries.putIfAbsent(name, text);
        return existing != null ? existing : text;
    }

    /**
     * Checks whether a formula has been expanded.
     *
     * @param name the formula name
     * @return true if an entry exists
     */
    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * Returns the number of cached expansions.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }
}
