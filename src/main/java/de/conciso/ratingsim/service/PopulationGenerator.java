package de.conciso.ratingsim.service;

import de.conciso.ratingsim.model.AttributeMatrix;
import de.conciso.ratingsim.model.LogNormalParameters;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Draws the latent attribute matrix. All cells share one log-normal target, drawn
 * row by row so a given seed always yields the same matrix.
 */
@Service
public class PopulationGenerator {

    private static final Logger log = LoggerFactory.getLogger(PopulationGenerator.class);

    private final LogNormalParameterizer parameterizer;

    public PopulationGenerator(LogNormalParameterizer parameterizer) {
        this.parameterizer = parameterizer;
    }

    public AttributeMatrix generate(int entities, int attributes, double mean, double sd, RandomGenerator random) {
        LogNormalParameters params = parameterizer.parameterize(mean, sd);
        log.debug("Population target mean={} sd={} -> location={} scale={}",
                mean, sd, params.location(), params.scale());

        double[][] cells = new double[entities][attributes];
        for (int i = 0; i < entities; i++) {
            for (int j = 0; j < attributes; j++) {
                cells[i][j] = params.sample(random);
            }
        }
        return AttributeMatrix.of(cells);
    }
}
