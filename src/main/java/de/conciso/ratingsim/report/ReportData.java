package de.conciso.ratingsim.report;

import de.conciso.ratingsim.model.AggregatedAccuracy;
import de.conciso.ratingsim.model.SimulationResult;

import java.time.Instant;
import java.util.List;

/**
 * Everything a report writer needs. {@code replications} is empty for a single run.
 */
public record ReportData(
        Instant timestamp,
        String runLabel,
        int runs,
        boolean includeScatter,
        SimulationResult result,
        List<AggregatedAccuracy> replications
) {
    public static ReportData of(SimulationResult result, List<AggregatedAccuracy> replications,
                                String runLabel, int runs, boolean includeScatter) {
        return new ReportData(Instant.now(), runLabel, runs, includeScatter, result, List.copyOf(replications));
    }
}
