/**
 * RandomWalkGenerator.java
 *
 * Description:
 *  Weighted-random walk over a MarkovModel.
 *
 *  Chooses every next token by weighted randomness over
 *      window -> (suffix, probability)
 *  and stops on the terminal token. A configured step cap (if any) applies
 *  to generate(prefix); generate(prefix, maxSteps) overrides it per call.
 */

package org.utd.cs.markovgraph;

import java.util.List;

public class RandomWalkGenerator implements SequenceGenerator {

    private final MarkovModel model;
    private final int defaultMaxSteps;

    public RandomWalkGenerator(MarkovModel model) {
        this(model, 0);
    }

    /**
     * @param defaultMaxSteps step cap used by {@link #generate(List)}; 0 for none
     */
    public RandomWalkGenerator(MarkovModel model, int defaultMaxSteps) {
        if (model == null) {
            throw new IllegalArgumentException("model must not be null");
        }
        if (defaultMaxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be >= 0: " + defaultMaxSteps);
        }
        this.model = model;
        this.defaultMaxSteps = defaultMaxSteps;
    }

    @Override
    public String getName() {
        return "RandomWalkGenerator";
    }

    @Override
    public List<String> generate(List<String> prefix) {
        return model.randomSequence(prefix, defaultMaxSteps);
    }

    @Override
    public List<String> generate(List<String> prefix, int maxSteps) {
        return model.randomSequence(prefix, maxSteps);
    }

    public int getDefaultMaxSteps() {
        return defaultMaxSteps;
    }
}
