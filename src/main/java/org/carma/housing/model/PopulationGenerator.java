package org.carma.housing.model;

import org.carma.housing.exception.IncomeSamplingException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded generation of buyer populations.
 *
 * Incomes come from a normal distribution truncated to [minimum, maximum] by
 * rejection sampling, dependents from a uniform integer range, and segments
 * uniformly from the three variants. The same seed always yields the same
 * population.
 */
public class PopulationGenerator {

    public static final int DEFAULT_MAX_SAMPLING_ATTEMPTS = 10_000;

    private final Random random;
    private final long seed;

    private double savingRate = Agent.DEFAULT_SAVING_RATE;
    private double interestRate = Agent.DEFAULT_INTEREST_RATE;
    private int referenceYear = Property.DEFAULT_REFERENCE_YEAR;
    private int maxSamplingAttempts = DEFAULT_MAX_SAMPLING_ATTEMPTS;

    public PopulationGenerator(long seed) {
        this(new Random(seed), seed);
    }

    /**
     * Share a random source with the caller, e.g. so that shuffling during
     * clearing continues the same seeded sequence.
     */
    public PopulationGenerator(Random random, long seed) {
        this.random = random;
        this.seed = seed;
    }

    // ========================================================================
    // Configuration Methods
    // ========================================================================

    public PopulationGenerator setRates(double savingRate, double interestRate) {
        this.savingRate = savingRate;
        this.interestRate = interestRate;
        return this;
    }

    public PopulationGenerator setReferenceYear(int referenceYear) {
        this.referenceYear = referenceYear;
        return this;
    }

    public PopulationGenerator setMaxSamplingAttempts(int maxSamplingAttempts) {
        if (maxSamplingAttempts <= 0) {
            throw new IllegalArgumentException("Sampling attempts must be positive");
        }
        this.maxSamplingAttempts = maxSamplingAttempts;
        return this;
    }

    /**
     * Reset the random generator to its initial seed.
     */
    public PopulationGenerator reset() {
        this.random.setSeed(seed);
        return this;
    }

    // ========================================================================
    // Sampling
    // ========================================================================

    /**
     * Draw one income inside the distribution's bounds.
     * @throws IncomeSamplingException if no draw lands in range within the attempt budget
     */
    public double sampleIncome(IncomeDistribution distribution) {
        for (int attempt = 0; attempt < maxSamplingAttempts; attempt++) {
            double income = distribution.average() + random.nextGaussian() * distribution.standardDeviation();
            if (distribution.contains(income)) {
                return income;
            }
        }
        throw new IncomeSamplingException(maxSamplingAttempts, distribution.minimum(), distribution.maximum());
    }

    public int sampleDependents(DependentsRange range) {
        return range.minimum() + random.nextInt(range.maximum() - range.minimum() + 1);
    }

    public Segment sampleSegment() {
        Segment[] segments = Segment.values();
        return segments[random.nextInt(segments.length)];
    }

    // ========================================================================
    // Agent Generation
    // ========================================================================

    /**
     * Generate {@code count} agents with ids 1..count.
     */
    public List<Agent> generate(int count, IncomeDistribution incomes, DependentsRange dependents) {
        if (count < 0) throw new IllegalArgumentException("Population size cannot be negative");
        List<Agent> agents = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            double income = sampleIncome(incomes);
            int children = sampleDependents(dependents);
            Segment segment = sampleSegment();
            agents.add(new Agent(i, income, children, segment, savingRate, interestRate, referenceYear));
        }
        return agents;
    }

    // ========================================================================
    // Statistics
    // ========================================================================

    /**
     * Count agents per segment.
     */
    public static Map<Segment, Integer> countBySegment(List<Agent> agents) {
        Map<Segment, Integer> counts = new EnumMap<>(Segment.class);
        for (Agent agent : agents) {
            counts.merge(agent.getSegment(), 1, Integer::sum);
        }
        return counts;
    }
}
