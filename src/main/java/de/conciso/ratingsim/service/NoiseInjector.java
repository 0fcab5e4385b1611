package de.conciso.ratingsim.service;

import de.conciso.ratingsim.model.AttributeMatrix;
import de.conciso.ratingsim.model.NoiseRegime;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces noisy observations of the true attribute matrix. Each observation is a
 * log-normal draw centred on the true value (expected value = true value) with the
 * linear-scale sd the regime assigns to that value, so observations stay positive.
 */
@Service
public class NoiseInjector {

    private static final Logger log = LoggerFactory.getLogger(NoiseInjector.class);

    private final LogNormalParameterizer parameterizer;

    public NoiseInjector(LogNormalParameterizer parameterizer) {
        this.parameterizer = parameterizer;
    }

    public AttributeMatrix inject(AttributeMatrix truth, NoiseRegime regime, RandomGenerator random) {
        double[][] noisy = new double[truth.entities()][truth.attributes()];
        for (int i = 0; i < truth.entities(); i++) {
            for (int j = 0; j < truth.attributes(); j++) {
                double value = truth.get(i, j);
                noisy[i][j] = parameterizer.parameterize(value, regime.noiseSd(value)).sample(random);
            }
        }
        return AttributeMatrix.of(noisy);
    }

    /**
     * Applies every regime to the full true matrix. Each regime draws from its own
     * stream seeded by (seed, regime name), so its output does not depend on which
     * other regimes run or in what order.
     */
    public Map<NoiseRegime, AttributeMatrix> injectAll(AttributeMatrix truth, List<NoiseRegime> regimes, long seed) {
        Map<NoiseRegime, AttributeMatrix> observations = new LinkedHashMap<>();
        for (NoiseRegime regime : regimes) {
            if (observations.containsKey(regime)) {
                log.warn("Noise regime {} listed twice, ignoring duplicate", regime.name());
                continue;
            }
            log.debug("Injecting noise: {}", regime.name());
            observations.put(regime, inject(truth, regime, randomFor(seed, regime)));
        }
        return observations;
    }

    static RandomGenerator randomFor(long seed, NoiseRegime regime) {
        return new Well19937c(new int[]{(int) (seed >>> 32), (int) seed, regime.name().hashCode()});
    }
}
