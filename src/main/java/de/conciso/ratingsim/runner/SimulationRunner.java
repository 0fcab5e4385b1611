package de.conciso.ratingsim.runner;

import de.conciso.ratingsim.exception.InvalidParameterException;
import de.conciso.ratingsim.model.AccuracyMetrics;
import de.conciso.ratingsim.model.AggregatedAccuracy;
import de.conciso.ratingsim.model.CombinationRule;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.PopulationSlice;
import de.conciso.ratingsim.model.SimulationConfig;
import de.conciso.ratingsim.model.SimulationResult;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import de.conciso.ratingsim.report.ReportWriter;
import de.conciso.ratingsim.service.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(name = "ratingsim.mode", havingValue = "simulate", matchIfMissing = true)
public class SimulationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    private final SimulationService simulationService;
    private final ReportWriter reportWriter;
    private final SimulationConfig config;
    private final int runs;

    public SimulationRunner(SimulationService simulationService, ReportWriter reportWriter,
                            SimulationConfig config,
                            @Value("${ratingsim.runs:1}") int runs) {
        this.simulationService = simulationService;
        this.reportWriter = reportWriter;
        if (runs < 1) {
            throw InvalidParameterException.of("runs", runs, ">= 1");
        }
        this.config = config;
        this.runs = runs;
    }

    @Override
    public void run(String... args) {
        System.out.println();
        System.out.println("=== RatingSim ===");
        System.out.printf("N=%d  K=%d  Attribute: Ø=%s σ=%s  Seed=%d  Läufe=%d%n",
                config.populationSize(), config.attributeCount(),
                config.attributeMean(), config.attributeSd(), config.seed(), runs);

        SimulationResult result = simulationService.simulate(config);
        List<AggregatedAccuracy> replications = runs > 1
                ? simulationService.simulateReplications(result, runs)
                : List.of();
        if (!replications.isEmpty()) {
            log.info("Aggregated {} cell(s) over {} runs", replications.size(), runs);
        }

        printSummary(result);
        reportWriter.write(result, replications, runs);
    }

    // -------------------------------------------------------------------------

    private void printSummary(SimulationResult result) {
        List<PopulationSlice> slices = config.slices();
        PopulationSlice first = slices.get(0);
        String sep = "-".repeat(24 + 20 * slices.size());

        for (TrueRatingDefinition definition : config.definitions()) {
            System.out.println();
            System.out.printf("-- Wahres Rating: %s --%n", definition.label());
            System.out.printf("%-22s %-8s", "Rauschen", "Regel");
            for (PopulationSlice slice : slices) {
                System.out.printf(" %10s %8s", "σ " + slice.name(), "r");
            }
            System.out.println();
            System.out.println(sep);

            for (NoiseRegime regime : config.regimes()) {
                CombinationRule best = bestRule(result, definition, regime, first);
                for (CombinationRule rule : config.rules()) {
                    System.out.printf("%-22s %-8s", regime.name(), rule.label());
                    for (PopulationSlice slice : slices) {
                        AccuracyMetrics m = result.table().get(definition, regime, rule, slice);
                        System.out.printf(" %10.1f %8.3f", m.rankErrorSd(), m.logCorrelation());
                    }
                    System.out.println(rule == best && config.rules().size() > 1 ? "  ★" : "");
                }
            }
            System.out.println(sep);
        }
        System.out.println();
    }

    // lowest rank error sd on the first configured slice
    private CombinationRule bestRule(SimulationResult result, TrueRatingDefinition definition,
                                     NoiseRegime regime, PopulationSlice slice) {
        CombinationRule best = null;
        double bestSd = Double.POSITIVE_INFINITY;
        for (CombinationRule rule : config.rules()) {
            double sd = result.table().get(definition, regime, rule, slice).rankErrorSd();
            if (sd < bestSd) {
                bestSd = sd;
                best = rule;
            }
        }
        return best;
    }
}
