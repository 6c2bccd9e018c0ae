package com.swarmprobe.core.behavior;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Weighted-random (roulette) choice over a candidate list.
 */
public class ActionSelector {

    /**
     * Draws uniformly over the total weight and returns the first candidate whose cumulative
     * weight exceeds the draw. Empty when there are no candidates or all weights are zero.
     */
    public Optional<ActionCandidate> select(List<ActionCandidate> candidates, Random random) {
        double total = 0;
        for (ActionCandidate c : candidates) {
            total += c.weight();
        }
        if (total <= 0) {
            return Optional.empty();
        }
        double draw = random.nextDouble() * total;
        double cumulative = 0;
        ActionCandidate lastPositive = null;
        for (ActionCandidate c : candidates) {
            if (c.weight() <= 0) {
                continue;
            }
            cumulative += c.weight();
            lastPositive = c;
            if (cumulative > draw) {
                return Optional.of(c);
            }
        }
        // rounding can leave the draw a hair above the final cumulative sum
        return Optional.ofNullable(lastPositive);
    }
}
