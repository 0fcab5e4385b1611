package de.conciso.ratingsim.service;

import de.conciso.ratingsim.exception.InvalidParameterException;
import de.conciso.ratingsim.model.AccuracyMetrics;
import de.conciso.ratingsim.model.AggregatedAccuracy;
import de.conciso.ratingsim.model.AttributeMatrix;
import de.conciso.ratingsim.model.EstimateKey;
import de.conciso.ratingsim.model.EvaluationKey;
import de.conciso.ratingsim.model.EvaluationTable;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.RatingSeries;
import de.conciso.ratingsim.model.SimulationConfig;
import de.conciso.ratingsim.model.SimulationResult;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the pipeline: population, ground truth, noise, aggregation, evaluation.
 * Every phase allocates its own output; earlier phases are only read.
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final PopulationGenerator populationGenerator;
    private final GroundTruthComposer groundTruthComposer;
    private final NoiseInjector noiseInjector;
    private final Aggregator aggregator;
    private final AccuracyEvaluator accuracyEvaluator;

    public SimulationService(PopulationGenerator populationGenerator,
                             GroundTruthComposer groundTruthComposer,
                             NoiseInjector noiseInjector,
                             Aggregator aggregator,
                             AccuracyEvaluator accuracyEvaluator) {
        this.populationGenerator = populationGenerator;
        this.groundTruthComposer = groundTruthComposer;
        this.noiseInjector = noiseInjector;
        this.aggregator = aggregator;
        this.accuracyEvaluator = accuracyEvaluator;
    }

    public SimulationResult simulate(SimulationConfig config) {
        long start = System.currentTimeMillis();
        log.info("Simulating N={} K={} mean={} sd={} seed={}",
                config.populationSize(), config.attributeCount(),
                config.attributeMean(), config.attributeSd(), config.seed());

        AttributeMatrix truth = populationGenerator.generate(
                config.populationSize(), config.attributeCount(),
                config.attributeMean(), config.attributeSd(),
                new Well19937c(config.seed()));

        Map<TrueRatingDefinition, RatingSeries> trueRatings =
                groundTruthComposer.composeAll(truth, config.definitions(), config.mixedWeight());
        log.info("Ground truth composed for {} definition(s)", trueRatings.size());

        Map<NoiseRegime, AttributeMatrix> observations =
                noiseInjector.injectAll(truth, config.regimes(), config.seed());
        log.info("Noise injected for {} regime(s)", observations.size());

        Map<EstimateKey, RatingSeries> estimates = aggregator.aggregateAll(observations, config.rules());
        log.info("Aggregated {} estimate(s)", estimates.size());

        EvaluationTable table = accuracyEvaluator.evaluateAll(trueRatings, estimates, config.slices());
        log.info("Evaluated {} cell(s) in {}s", table.size(),
                String.format("%.2f", (System.currentTimeMillis() - start) / 1000.0));

        return new SimulationResult(config, truth, trueRatings, observations, estimates, table);
    }

    /**
     * Repeats the run with seeds {@code seed, seed+1, ...} and averages every cell.
     */
    public List<AggregatedAccuracy> simulateReplications(SimulationConfig config, int runs) {
        if (runs < 1) {
            throw InvalidParameterException.of("runs", runs, ">= 1");
        }
        return simulateReplications(simulate(config), runs);
    }

    /**
     * Same as {@link #simulateReplications(SimulationConfig, int)}, with {@code first}
     * standing in for the run at the configured seed.
     */
    public List<AggregatedAccuracy> simulateReplications(SimulationResult first, int runs) {
        if (runs < 1) {
            throw InvalidParameterException.of("runs", runs, ">= 1");
        }
        SimulationConfig config = first.config();
        Map<EvaluationKey, List<AccuracyMetrics>> byCell = new LinkedHashMap<>();
        collect(byCell, first.table());
        for (int i = 1; i < runs; i++) {
            long seed = config.seed() + i;
            log.info("Replication ({}/{}) seed={}", i + 1, runs, seed);
            collect(byCell, simulate(config.withSeed(seed)).table());
        }
        return byCell.entrySet().stream()
                .map(e -> AggregatedAccuracy.of(e.getKey(), e.getValue()))
                .toList();
    }

    private static void collect(Map<EvaluationKey, List<AccuracyMetrics>> byCell, EvaluationTable table) {
        table.cells().forEach((key, metrics) ->
                byCell.computeIfAbsent(key, k -> new ArrayList<>()).add(metrics));
    }
}
