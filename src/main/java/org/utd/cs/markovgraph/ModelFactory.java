/**
 * ModelFactory.java
 *
 * Description:
 *  Builds models and generators from a ModelConfig so callers do not need to
 *  know how the random source or step cap are wired.
 *
 *  Supported generators:
 *    - "random-walk" → RandomWalkGenerator
 */

package org.utd.cs.markovgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Random;

public class ModelFactory {
    private static final Logger logger = LoggerFactory.getLogger(ModelFactory.class);

    public static final String RANDOM_WALK = "random-walk";

    public static MarkovModel createModel(ModelConfig config) {
        return new MarkovModel(config.getOrder(), createRandom(config));
    }

    public static Random createRandom(ModelConfig config) {
        return config.getSeed().isPresent()
                ? new Random(config.getSeed().getAsLong())
                : new Random();
    }

    /**
     * @throws IllegalArgumentException if {@code name} is not a known generator
     */
    public static SequenceGenerator createGenerator(String name, MarkovModel model, ModelConfig config) {
        String algo = name == null ? "" : name.toLowerCase(Locale.ROOT);
        switch (algo) {
            case RANDOM_WALK:
                logger.debug("random walk generator created, maxSteps={}", config.getMaxSteps());
                return new RandomWalkGenerator(model, config.getMaxSteps());
            default:
                throw new IllegalArgumentException("Unknown generator: " + name);
        }
    }
}
