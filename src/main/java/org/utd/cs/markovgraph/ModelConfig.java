/**
 * ModelConfig.java
 *
 * Description:
 *  Model and sampler settings read from a classpath properties file
 *  (markov.properties by default):
 *    model.order        n-gram length, integer >= 2 (required)
 *    sampler.seed       seed for the random source (optional)
 *    sampler.max-steps  step cap for random walks, 0 = none (optional)
 */

package org.utd.cs.markovgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.OptionalLong;
import java.util.Properties;

public class ModelConfig {
    private static final Logger logger = LoggerFactory.getLogger(ModelConfig.class);

    public static final String DEFAULT_RESOURCE = "markov.properties";

    private final int order;
    private final OptionalLong seed;
    private final int maxSteps;

    public ModelConfig(int order, OptionalLong seed, int maxSteps) {
        if (order < 2) {
            throw new IllegalArgumentException("N-gram length must be at least 2");
        }
        if (maxSteps < 0) {
            throw new IllegalArgumentException("sampler.max-steps must be >= 0: " + maxSteps);
        }
        this.order = order;
        this.seed = seed;
        this.maxSteps = maxSteps;
    }

    public static ModelConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalStateException if the resource is missing, unreadable or invalid
     */
    public static ModelConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream in = ModelConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {throw new IllegalStateException("Model config file not found: " + resource);}
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model config: " + resource, e);
        }

        try {
            ModelConfig config = fromProperties(props);
            logger.info("Loaded model config from {}: order={}, seed={}, maxSteps={}",
                    resource, config.order, config.seed, config.maxSteps);
            return config;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid model config: " + resource, e);
        }
    }

    public static ModelConfig fromProperties(Properties props) {
        int order = MarkovModel.parseOrder(props.getProperty("model.order"));

        OptionalLong seed = OptionalLong.empty();
        String rawSeed = props.getProperty("sampler.seed");
        if (rawSeed != null && !rawSeed.isBlank()) {
            try {
                seed = OptionalLong.of(Long.parseLong(rawSeed.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("sampler.seed is not a long: " + rawSeed, e);
            }
        }

        int maxSteps = 0;
        String rawMax = props.getProperty("sampler.max-steps");
        if (rawMax != null && !rawMax.isBlank()) {
            try {
                maxSteps = Integer.parseInt(rawMax.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("sampler.max-steps is not an integer: " + rawMax, e);
            }
        }

        return new ModelConfig(order, seed, maxSteps);
    }

    public int getOrder() { return order; }
    public OptionalLong getSeed() { return seed; }
    public int getMaxSteps() { return maxSteps; }
}
