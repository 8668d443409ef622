/**
 * TransitionGraph.java
 *
 * Description:
 *  Weighted, directed transition graph:
 *      prefixKey -> (suffix -> count)
 *
 *  Prefix keys are the prefix tokens concatenated with no separator, so the
 *  whole graph stays a plain string-keyed nested map that can be written out
 *  as JSON. The concatenation is lossy: ("a", "bc") and ("ab", "c") share the
 *  key "abc".
 *
 *  Suffixes keep first-insertion order for every prefix. Counts are longs and
 *  only grow; an increment that would overflow is rejected before any change.
 */

package org.utd.cs.markovgraph;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class TransitionGraph {

    private final Map<String, Map<String, Long>> graph = new LinkedHashMap<>();

    /**
     * Concatenates tokens into a prefix key.
     *
     * @throws IllegalArgumentException if any token is null
     */
    public static String prefixKey(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String t : tokens) {
            if (t == null) {
                throw new IllegalArgumentException("prefix is: " + tokens);
            }
            sb.append(t);
        }
        return sb.toString();
    }

    /**
     * Adds {@code by} occurrences of prefixKey -> suffix.
     *
     * @throws ArithmeticException if the count would overflow; the graph is left unchanged
     */
    void increment(String prefixKey, String suffix, long by) {
        if (by < 1) {
            throw new IllegalArgumentException("count increment must be positive: " + by);
        }
        Math.addExact(countOf(prefixKey, suffix), by);
        graph.computeIfAbsent(prefixKey, k -> new LinkedHashMap<>())
             .merge(suffix, by, Long::sum);
    }

    /**
     * Adds every count in {@code other} to this graph. Prefixes missing here are
     * copied whole; shared prefixes are summed suffix by suffix. Merging a graph
     * into itself doubles every count.
     *
     * @throws ArithmeticException if any count would overflow; checked before
     *                             anything is changed
     */
    void merge(TransitionGraph other) {
        Map<String, Map<String, Long>> source = other == this ? copyRows() : other.graph;

        for (Map.Entry<String, Map<String, Long>> e : source.entrySet()) {
            for (Map.Entry<String, Long> s : e.getValue().entrySet()) {
                Math.addExact(countOf(e.getKey(), s.getKey()), s.getValue());
            }
        }

        for (Map.Entry<String, Map<String, Long>> e : source.entrySet()) {
            Map<String, Long> mine = graph.get(e.getKey());
            if (mine == null) {
                graph.put(e.getKey(), new LinkedHashMap<>(e.getValue()));
                continue;
            }
            for (Map.Entry<String, Long> s : e.getValue().entrySet()) {
                mine.merge(s.getKey(), s.getValue(), Long::sum);
            }
        }
    }

    /** Suffix counts for a prefix key, in first-insertion order. Empty if unseen. */
    public Map<String, Long> suffixCounts(String prefixKey) {
        Map<String, Long> row = graph.get(prefixKey);
        if (row == null) return Map.of();
        return Collections.unmodifiableMap(row);
    }

    public long countOf(String prefixKey, String suffix) {
        Map<String, Long> row = graph.get(prefixKey);
        if (row == null) return 0L;
        return row.getOrDefault(suffix, 0L);
    }

    public boolean containsPrefix(String prefixKey) {
        return graph.containsKey(prefixKey);
    }

    public Set<String> prefixKeys() {
        return Collections.unmodifiableSet(graph.keySet());
    }

    public int size() {
        return graph.size();
    }

    public boolean isEmpty() {
        return graph.isEmpty();
    }

    /** Read-only nested view of the whole graph. */
    public Map<String, Map<String, Long>> asMap() {
        Map<String, Map<String, Long>> view = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Long>> e : graph.entrySet()) {
            view.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    private Map<String, Map<String, Long>> copyRows() {
        Map<String, Map<String, Long>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Long>> e : graph.entrySet()) {
            copy.put(e.getKey(), new LinkedHashMap<>(e.getValue()));
        }
        return copy;
    }

    // ---------- interchange ----------

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        for (Map.Entry<String, Map<String, Long>> e : graph.entrySet()) {
            JSONObject row = new JSONObject();
            for (Map.Entry<String, Long> s : e.getValue().entrySet()) {
                row.put(s.getKey(), s.getValue().longValue());
            }
            out.put(e.getKey(), row);
        }
        return out;
    }

    /**
     * Rebuilds a graph from the nested object written by {@link #toJson()}.
     * Suffix order follows the key order org.json exposes for each row.
     *
     * @throws IllegalArgumentException if a row is not an object or a count is
     *                                  not a positive integer
     */
    public static TransitionGraph fromJson(JSONObject obj) {
        TransitionGraph g = new TransitionGraph();
        try {
            for (String prefix : obj.keySet()) {
                JSONObject row = obj.getJSONObject(prefix);
                for (String suffix : row.keySet()) {
                    Object raw = row.get(suffix);
                    if (!(raw instanceof Integer) && !(raw instanceof Long)) {
                        throw new IllegalArgumentException(
                                "count for " + prefix + " -> " + suffix + " is not a long integer: " + raw);
                    }
                    long count = ((Number) raw).longValue();
                    if (count < 1) {
                        throw new IllegalArgumentException(
                                "count for " + prefix + " -> " + suffix + " out of range: " + count);
                    }
                    g.increment(prefix, suffix, count);
                }
            }
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed transition graph document.", e);
        }
        return g;
    }
}
