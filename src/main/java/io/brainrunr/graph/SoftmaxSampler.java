package io.brainrunr.graph;

import java.util.Random;

/**
 * Temperature-controlled choice among weighted candidates.
 *
 * <p>Low temperature concentrates the choice on the strongest candidate; high temperature
 * flattens it toward uniform. At or below {@link #GREEDY_TEMPERATURE} the strongest
 * candidate is always picked, the first one on ties.</p>
 */
public class SoftmaxSampler {

    public static final double GREEDY_TEMPERATURE = 1e-6;

    private final Random random;

    public SoftmaxSampler(Random random) {
        this.random = random;
    }

    /** Selection probabilities, proportional to {@code exp((s_i - max s) / T)}. */
    public static double[] probabilities(double[] scores, double temperature) {
        double[] probs = new double[scores.length];
        if (scores.length == 0) {
            return probs;
        }
        int best = argmax(scores);
        if (temperature <= GREEDY_TEMPERATURE) {
            probs[best] = 1.0;
            return probs;
        }
        double max = scores[best];
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            probs[i] = Math.exp((scores[i] - max) / temperature);
            sum += probs[i];
        }
        for (int i = 0; i < probs.length; i++) {
            probs[i] /= sum;
        }
        return probs;
    }

    /**
     * Draws one index.
     *
     * @throws IllegalArgumentException if there are no candidates
     */
    public int sample(double[] scores, double temperature) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("No candidates to sample from");
        }
        if (temperature <= GREEDY_TEMPERATURE) {
            return argmax(scores);
        }
        double[] probs = probabilities(scores, temperature);
        double r = random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < probs.length; i++) {
            cumulative += probs[i];
            if (r < cumulative) {
                return i;
            }
        }
        return probs.length - 1;
    }

    private static int argmax(double[] scores) {
        int best = 0;
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] > scores[best]) {
                best = i;
            }
        }
        return best;
    }
}
