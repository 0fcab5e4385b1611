package de.conciso.ratingsim.service;

import de.conciso.ratingsim.model.AttributeMatrix;
import de.conciso.ratingsim.model.CombinationRule;
import de.conciso.ratingsim.model.EstimateKey;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.RatingSeries;
import de.conciso.ratingsim.model.SimulationConfig;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AggregatorTest {

    private final Aggregator aggregator = new Aggregator();

    @Test
    void sumAndProductDisagreeOnRanking() {
        AttributeMatrix observations = AttributeMatrix.of(new double[][]{
                {1.0, 9.0},   // sum 10, product 9
                {3.0, 4.0},   // sum 7, product 12
        });

        RatingSeries sum = aggregator.aggregate(observations, CombinationRule.SUM);
        RatingSeries product = aggregator.aggregate(observations, CombinationRule.PRODUCT);

        assertThat(sum.values()).containsExactly(10.0, 7.0);
        assertThat(sum.ranking().ranks()).containsExactly(1.0, 2.0);
        assertThat(product.values()).containsExactly(9.0, 12.0);
        assertThat(product.ranking().ranks()).containsExactly(2.0, 1.0);
    }

    @Test
    void aggregateAllCoversEveryRegimeRulePair() {
        AttributeMatrix m = AttributeMatrix.of(new double[][]{{1.0, 2.0}, {2.0, 3.0}});
        Map<NoiseRegime, AttributeMatrix> observations = new LinkedHashMap<>();
        for (NoiseRegime regime : SimulationConfig.standardRegimes()) {
            observations.put(regime, m);
        }

        Map<EstimateKey, RatingSeries> estimates = aggregator.aggregateAll(observations,
                List.of(CombinationRule.SUM, CombinationRule.PRODUCT));

        assertThat(estimates).hasSize(10);
        assertThat(estimates.get(new EstimateKey(NoiseRegime.constant(0.25), CombinationRule.PRODUCT)).values())
                .containsExactly(2.0, 6.0);
    }
}
