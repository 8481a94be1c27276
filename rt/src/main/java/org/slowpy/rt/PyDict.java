package org.slowpy.rt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The Python {@code dict} object. Keys are restricted to text, and
 * iteration (and rendering) follows insertion order.
 */
public final class PyDict extends Kind {

    private final Map<String, PyRef> map;

    /** Construct empty. */
    public PyDict() { this.map = new LinkedHashMap<>(); }

    /**
     * Construct from a map, taking over the value handles.
     *
     * @param map initial content (values given)
     */
    public PyDict(Map<String, PyRef> map) {
        this.map = new LinkedHashMap<>(map);
    }

    @Override
    public Tag getTag() { return Tag.DICT; }

    /** @return number of entries */
    public int size() {
        checkReadable();
        return map.size();
    }

    /**
     * Value for a key (borrowed).
     *
     * @param key to look up
     * @return value or {@code null} if absent
     */
    public PyRef get(String key) {
        checkReadable();
        return map.get(key);
    }

    /** @return unmodifiable view of the keys */
    public Set<String> keys() {
        checkReadable();
        return Collections.unmodifiableSet(map.keySet());
    }

    /**
     * Associate a value with a key, releasing any value it replaces.
     *
     * @param key of entry
     * @param value of entry (given)
     */
    public void put(String key, PyRef value) {
        checkWritable();
        PyRef old = map.put(key, value);
        if (old != null) { old.release(); }
    }

    /**
     * Remove an entry.
     *
     * @param key of entry
     * @return the value (now owned by the caller) or {@code null}
     */
    public PyRef remove(String key) {
        checkWritable();
        return map.remove(key);
    }

    @Override
    void render(Renderer r) {
        checkReadable();
        r.enclosed(this, "{", "}", () -> {
            String sep = "";
            for (Map.Entry<String, PyRef> e : map.entrySet()) {
                r.append(sep).append("'").append(e.getKey())
                        .append("': ").append(e.getValue());
                sep = ", ";
            }
        });
    }

    @Override
    void forEachReference(Consumer<PyRef> action) {
        map.values().forEach(action);
    }
}
