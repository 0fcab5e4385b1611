package de.conciso.ratingsim.service;

import de.conciso.ratingsim.model.AttributeMatrix;
import de.conciso.ratingsim.model.RatingSeries;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GroundTruthComposerTest {

    private final GroundTruthComposer composer = new GroundTruthComposer();

    private final AttributeMatrix matrix = AttributeMatrix.of(new double[][]{
            {1.0, 2.0, 3.0, 4.0},
            {2.0, 2.0, 2.0, 2.0},
            {0.5, 1.0, 1.5, 2.0}
    });

    @Test
    void productMultipliesAllAttributes() {
        RatingSeries truth = composer.compose(matrix, TrueRatingDefinition.PRODUCT, 5.0);

        assertThat(truth.values()).containsExactly(24.0, 16.0, 1.5);
        assertThat(truth.ranking().ranks()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void mixedAddsWeightedProductOfSecondHalf() {
        RatingSeries truth = composer.compose(matrix, TrueRatingDefinition.MIXED, 5.0);

        // 1*2 + 5*(3*4), 2*2 + 5*(2*2), 0.5*1 + 5*(1.5*2)
        assertThat(truth.values()).containsExactly(62.0, 24.0, 15.5);
    }

    @Test
    void mixedPutsMiddleAttributeInFirstHalfForOddCount() {
        AttributeMatrix odd = AttributeMatrix.of(new double[][]{{2.0, 3.0, 5.0, 7.0, 11.0}});

        RatingSeries truth = composer.compose(odd, TrueRatingDefinition.MIXED, 5.0);

        assertThat(truth.value(0)).isEqualTo(2.0 * 3.0 * 5.0 + 5.0 * 7.0 * 11.0);
    }

    @Test
    void sumAddsAllAttributes() {
        RatingSeries truth = composer.compose(matrix, TrueRatingDefinition.SUM, 5.0);

        assertThat(truth.values()).containsExactly(10.0, 8.0, 5.0);
    }

    @Test
    void composeAllUsesTheSameMatrixForEveryDefinition() {
        Map<TrueRatingDefinition, RatingSeries> truths = composer.composeAll(matrix,
                List.of(TrueRatingDefinition.PRODUCT, TrueRatingDefinition.MIXED), 5.0);

        assertThat(truths).containsOnlyKeys(TrueRatingDefinition.PRODUCT, TrueRatingDefinition.MIXED);
        assertThat(truths.get(TrueRatingDefinition.PRODUCT))
                .isEqualTo(composer.compose(matrix, TrueRatingDefinition.PRODUCT, 5.0));
        assertThat(truths.get(TrueRatingDefinition.MIXED).size()).isEqualTo(matrix.entities());
    }
}
