/**
 * MarkovModel.java
 *
 * Description:
 *  Graph-based n-gram Markov model.
 *
 *  Each n-gram of length {@code order} is split into a prefix (the first
 *  order - 1 tokens, concatenated into a key) and a suffix (the last token).
 *  Ingestion counts prefix -> suffix transitions; probabilities are derived
 *  from the counts on every read. Sampling walks the graph one suffix at a
 *  time until the terminal token ("") is drawn.
 *
 *  Not thread-safe. Callers sharing a model must serialize access.
 */

package org.utd.cs.markovgraph;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

public class MarkovModel {
    private static final Logger logger = LoggerFactory.getLogger(MarkovModel.class);

    /** Suffix that marks the end of a generated sequence. */
    public static final String TERMINAL = "";

    private final int order;
    private final TransitionGraph graph;
    private final Random random;

    public MarkovModel(int order) {
        this(order, new Random());
    }

    /**
     * @param order  n-gram length, at least 2
     * @param random source for every sampling draw
     * @throws IllegalArgumentException if {@code order < 2}
     */
    public MarkovModel(int order, Random random) {
        if (order < 2) {
            throw new IllegalArgumentException("N-gram length must be at least 2");
        }
        if (random == null) {
            throw new IllegalArgumentException("random source must not be null");
        }
        this.order = order;
        this.random = random;
        this.graph = new TransitionGraph();
    }

    /**
     * Parses an n-gram length from text (configuration, documents).
     *
     * @throws IllegalArgumentException if the text is not an integer (e.g. "2.0")
     *                                  or is less than 2
     */
    public static int parseOrder(String text) {
        if (text == null) {
            throw new IllegalArgumentException("N-gram length must be an integer");
        }
        int n;
        try {
            n = Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("N-gram length must be an integer: " + text, e);
        }
        if (n < 2) {
            throw new IllegalArgumentException("N-gram length must be at least 2");
        }
        return n;
    }

    public int order() {
        return order;
    }

    // ---------- accumulation ----------

    public void addNgram(String... ngram) {
        addNgram(asTokens(ngram));
    }

    /**
     * Records one occurrence of {@code ngram}: the first order - 1 tokens are
     * the source, the last token the destination.
     *
     * @throws IllegalArgumentException if the length is not {@code order} or a token is null
     * @throws ArithmeticException      if the count is already at {@code Long.MAX_VALUE}
     */
    public void addNgram(List<String> ngram) {
        if (ngram == null || ngram.size() != order) {
            throw new IllegalArgumentException("ngram input must be of length: " + order);
        }
        String destination = ngram.get(order - 1);
        if (destination == null) {
            throw new IllegalArgumentException("ngram is: " + ngram);
        }
        String source = TransitionGraph.prefixKey(ngram.subList(0, order - 1));
        graph.increment(source, destination, 1);
    }

    /**
     * Records every window of {@code order} tokens over {@code tokens} followed
     * by {@link #TERMINAL}, so walks started from this sequence can end.
     *
     * @throws IllegalArgumentException if fewer than order - 1 tokens are given
     *                                  or a token is null
     */
    public void addSequence(List<String> tokens) {
        if (tokens == null || tokens.size() < order - 1) {
            throw new IllegalArgumentException("sequence must hold at least " + (order - 1) + " tokens");
        }
        for (String t : tokens) {
            if (t == null) {
                throw new IllegalArgumentException("sequence is: " + tokens);
            }
        }
        List<String> padded = new ArrayList<>(tokens);
        padded.add(TERMINAL);
        for (int i = 0; i + order <= padded.size(); i++) {
            addNgram(padded.subList(i, i + order));
        }
    }

    /**
     * Adds all of the n-gram occurrences recorded in {@code other} to this
     * model. Not idempotent: merging the same model twice counts it twice.
     *
     * @throws OrderMismatchException if the orders differ
     * @throws ArithmeticException    if a merged count would overflow; nothing is changed
     */
    public void update(MarkovModel other) {
        if (other == null) {
            throw new IllegalArgumentException("model to merge must not be null");
        }
        if (other.order != order) {
            throw new OrderMismatchException(order, other.order);
        }
        logger.debug("Merging {} prefixes into model with {} prefixes", other.graph.size(), graph.size());
        graph.merge(other.graph);
    }

    // ---------- probability view ----------

    public Map<String, Double> getSuffixes(String... prefix) {
        return getSuffixes(asTokens(prefix));
    }

    /**
     * Maps each suffix observed after {@code prefix} to count / total, in
     * first-insertion order. Empty if the prefix was never observed.
     *
     * @throws IllegalArgumentException if the length is not order - 1 or a token is null
     */
    public Map<String, Double> getSuffixes(List<String> prefix) {
        String key = checkedPrefixKey(prefix);
        Map<String, Long> counts = graph.suffixCounts(key);
        if (counts.isEmpty()) return Map.of();

        // double: a long total of near-max counts overflows
        double total = 0;
        for (long c : counts.values()) total += c;

        Map<String, Double> mapping = new LinkedHashMap<>();
        for (Map.Entry<String, Long> e : counts.entrySet()) {
            mapping.put(e.getKey(), (double) e.getValue() / total);
        }
        return mapping;
    }

    public Map<List<String>, Double> getNgrams(String... prefix) {
        return getNgrams(asTokens(prefix));
    }

    /** Same probabilities as {@link #getSuffixes(List)}, keyed by the full n-gram. */
    public Map<List<String>, Double> getNgrams(List<String> prefix) {
        Map<String, Double> suffixes = getSuffixes(prefix);
        Map<List<String>, Double> ngrams = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : suffixes.entrySet()) {
            ngrams.put(append(prefix, e.getKey()), e.getValue());
        }
        return ngrams;
    }

    // ---------- sampling ----------

    public Optional<String> randomSuffix(String... prefix) {
        return randomSuffix(asTokens(prefix));
    }

    /** Weighted draw of one suffix; empty when the prefix has no observed suffix. */
    public Optional<String> randomSuffix(List<String> prefix) {
        Map<String, Double> distribution = getSuffixes(prefix);
        return WeightedSampler.draw(distribution, random);
    }

    public Optional<List<String>> randomNgram(String... prefix) {
        return randomNgram(asTokens(prefix));
    }

    public Optional<List<String>> randomNgram(List<String> prefix) {
        return randomSuffix(prefix).map(suffix -> append(prefix, suffix));
    }

    /**
     * Walks the graph from {@code prefix} until the terminal token is drawn.
     * The returned sequence starts with the prefix and ends with the terminal
     * token. There is no step limit; see {@link #randomSequence(List, int)}.
     *
     * @throws IllegalStateException if the walk reaches a window with no observed suffix
     */
    public List<String> randomSequence(List<String> prefix) {
        return randomSequence(prefix, 0);
    }

    public List<String> randomSequence(String... prefix) {
        return randomSequence(asTokens(prefix));
    }

    /**
     * Random walk with an optional safety cap. With {@code maxSteps > 0} the
     * walk stops after that many draws and returns the partial sequence, which
     * then does not end with the terminal token. {@code maxSteps <= 0} means
     * unbounded.
     *
     * @throws IllegalStateException if the walk reaches a window with no observed suffix
     */
    public List<String> randomSequence(List<String> prefix, int maxSteps) {
        checkedPrefixKey(prefix);

        Deque<String> window = new ArrayDeque<>(prefix);
        List<String> sequence = new ArrayList<>(prefix);

        int steps = 0;
        while (maxSteps <= 0 || steps < maxSteps) {
            List<String> current = new ArrayList<>(window);
            String suffix = randomSuffix(current).orElseThrow(() ->
                    new IllegalStateException("No suffix observed for prefix: " + current));
            steps++;
            sequence.add(suffix);
            logger.debug("step {}: {} -> '{}'", steps, current, suffix);
            if (suffix.equals(TERMINAL)) {
                return sequence;
            }
            window.removeFirst();
            window.addLast(suffix);
        }

        logger.warn("Random walk from {} stopped after {} steps without reaching the terminal token",
                prefix, maxSteps);
        return sequence;
    }

    // ---------- graph access ----------

    public long countOf(List<String> prefix, String suffix) {
        return graph.countOf(checkedPrefixKey(prefix), suffix);
    }

    public int prefixCount() {
        return graph.size();
    }

    public boolean isEmpty() {
        return graph.isEmpty();
    }

    public Map<String, Map<String, Long>> graphView() {
        return graph.asMap();
    }

    // ---------- interchange ----------

    /** {"order": n, "graph": {prefixKey: {suffix: count}}} */
    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("order", order);
        obj.put("graph", graph.toJson());
        return obj;
    }

    public static MarkovModel fromJson(String json, Random random) {
        try {
            return fromJson(new JSONObject(json), random);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed model document.", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the order is missing or invalid or the
     *                                  graph is malformed
     */
    public static MarkovModel fromJson(JSONObject obj, Random random) {
        Object rawOrder = obj.opt("order");
        if (rawOrder == null) {
            throw new IllegalArgumentException("Model document has no order.");
        }
        int n = parseOrder(rawOrder.toString());

        JSONObject rawGraph = obj.optJSONObject("graph");
        if (rawGraph == null) {
            throw new IllegalArgumentException("Model document has no graph object.");
        }
        MarkovModel model = new MarkovModel(n, random);
        model.graph.merge(TransitionGraph.fromJson(rawGraph));
        return model;
    }

    // ---------- internals ----------

    private String checkedPrefixKey(List<String> prefix) {
        if (prefix == null || prefix.size() != order - 1) {
            throw new IllegalArgumentException("prefix must be of length: " + (order - 1));
        }
        return TransitionGraph.prefixKey(prefix);
    }

    private static List<String> asTokens(String[] tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens must not be null");
        }
        return Arrays.asList(tokens);
    }

    private static List<String> append(List<String> prefix, String suffix) {
        List<String> ngram = new ArrayList<>(prefix.size() + 1);
        ngram.addAll(prefix);
        ngram.add(suffix);
        return Collections.unmodifiableList(ngram);
    }
}
