package com.forecastplatform.common.simulation;

import com.forecastplatform.common.model.MonteCarloResult;

import java.util.Arrays;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Monte Carlo estimator of a party's vote share under Gaussian noise.
 *
 * <p>Each iteration draws {@code z ~ N(0, 1)} via the Box–Muller transform and
 * produces {@code base + trendAdjustment + z * volatility}, clamped to
 * {@code [0, maxVoteShare]}. Samples are sorted ascending and summarised:
 * <ul>
 *   <li>median: {@code samples[floor(n / 2)]} (upper middle element for even n)</li>
 *   <li>lower:  {@code samples[floor(n * (1 - cl) / 2)]}</li>
 *   <li>upper:  {@code samples[floor(n * (1 - (1 - cl) / 2))]}, clamped to {@code n - 1}</li>
 *   <li>standard deviation with divisor {@code n - 1}</li>
 * </ul>
 *
 * <p>The random source is a parameter so callers can seed it for reproducible runs.
 * Pure function otherwise: no shared state, safe to call from any thread with
 * its own generator.
 */
public final class MonteCarloSimulator {

    public static final int    DEFAULT_ITERATIONS       = 10_000;
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    /** A vote share is a percentage; no sample may exceed it. */
    public static final double MAX_VOTE_SHARE = 100.0;

    private static final double TWO_PI = 2.0 * Math.PI;

    private MonteCarloSimulator() {}

    public static MonteCarloResult simulate(double baseValue, double volatility, double trendAdjustment) {
        return simulate(baseValue, volatility, trendAdjustment,
            DEFAULT_ITERATIONS, DEFAULT_CONFIDENCE_LEVEL, new SplittableRandom());
    }

    public static MonteCarloResult simulate(double baseValue, double volatility, double trendAdjustment,
                                            int iterations, double confidenceLevel, RandomGenerator random) {
        return simulate(baseValue, volatility, trendAdjustment, iterations, confidenceLevel,
            MAX_VOTE_SHARE, random);
    }

    /**
     * @param baseValue       centre of the distribution (a share in percent)
     * @param volatility      standard deviation of the noise; 0 gives a degenerate distribution
     * @param trendAdjustment additive shift applied to every sample
     * @param iterations      number of samples, at least 1
     * @param confidenceLevel width of the interval, strictly between 0 and 1
     * @param maxVoteShare    upper clamp of every sample
     * @param random          source of uniform draws
     * @throws IllegalArgumentException if {@code iterations < 1} or {@code confidenceLevel} is out of range
     */
    public static MonteCarloResult simulate(double baseValue, double volatility, double trendAdjustment,
                                            int iterations, double confidenceLevel, double maxVoteShare,
                                            RandomGenerator random) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1, got " + iterations);
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1), got " + confidenceLevel);
        }

        double centre = baseValue + trendAdjustment;
        double[] samples = new double[iterations];
        double sum = 0;
        for (int i = 0; i < iterations; i++) {
            double sample = centre + nextStandardNormal(random) * volatility;
            sample = Math.min(maxVoteShare, Math.max(0.0, sample));
            samples[i] = sample;
            sum += sample;
        }
        Arrays.sort(samples);

        double mean = sum / iterations;
        double median = samples[iterations / 2];
        double lower = samples[boundIndex(iterations * ((1 - confidenceLevel) / 2), iterations)];
        double upper = samples[boundIndex(iterations * (1 - (1 - confidenceLevel) / 2), iterations)];

        return new MonteCarloResult(
            Arrays.stream(samples).boxed().toList(),
            mean, median, lower, upper,
            standardDeviation(samples, mean));
    }

    /**
     * One standard normal draw. {@code u1} is taken from {@code (0, 1]} so the
     * logarithm stays finite.
     */
    public static double nextStandardNormal(RandomGenerator random) {
        double u1 = 1.0 - random.nextDouble();
        double u2 = random.nextDouble();
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(TWO_PI * u2);
    }

    private static int boundIndex(double position, int size) {
        int index = (int) Math.floor(position);
        return Math.max(0, Math.min(size - 1, index));
    }

    private static double standardDeviation(double[] samples, double mean) {
        if (samples.length < 2) return 0.0;
        double squared = 0;
        for (double s : samples) {
            double diff = s - mean;
            squared += diff * diff;
        }
        return Math.sqrt(squared / (samples.length - 1));
    }
}
