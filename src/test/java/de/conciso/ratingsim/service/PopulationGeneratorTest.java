package de.conciso.ratingsim.service;

import de.conciso.ratingsim.exception.InvalidParameterException;
import de.conciso.ratingsim.model.AttributeMatrix;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PopulationGeneratorTest {

    private final PopulationGenerator generator = new PopulationGenerator(new LogNormalParameterizer());

    @Test
    void sameSeedGivesBitIdenticalMatrix() {
        AttributeMatrix first = generator.generate(500, 10, 2.0, 1.0, new Well19937c(13L));
        AttributeMatrix second = generator.generate(500, 10, 2.0, 1.0, new Well19937c(13L));

        assertThat(second).isEqualTo(first);
        assertThat(second.toArray()).isDeepEqualTo(first.toArray());
    }

    @Test
    void differentSeedGivesDifferentMatrix() {
        AttributeMatrix first = generator.generate(100, 10, 2.0, 1.0, new Well19937c(13L));
        AttributeMatrix second = generator.generate(100, 10, 2.0, 1.0, new Well19937c(14L));

        assertThat(second).isNotEqualTo(first);
    }

    @Test
    void attributesFollowTargetLinearMoments() {
        AttributeMatrix m = generator.generate(20_000, 10, 2.0, 1.0, new Well19937c(99L));

        assertThat(m.entities()).isEqualTo(20_000);
        assertThat(m.attributes()).isEqualTo(10);

        SummaryStatistics all = new SummaryStatistics();
        for (int i = 0; i < m.entities(); i++) {
            for (int j = 0; j < m.attributes(); j++) all.addValue(m.get(i, j));
        }
        assertThat(all.getMin()).isPositive();
        assertThat(all.getMean()).isCloseTo(2.0, within(0.02));
        assertThat(Math.sqrt(all.getPopulationVariance())).isCloseTo(1.0, within(0.03));
    }

    @Test
    void everyAttributeColumnSharesTheSameDistribution() {
        AttributeMatrix m = generator.generate(20_000, 4, 2.0, 1.0, new Well19937c(5L));

        for (int j = 0; j < m.attributes(); j++) {
            SummaryStatistics column = new SummaryStatistics();
            for (double v : m.column(j)) column.addValue(v);
            assertThat(column.getMean()).as("column %d mean", j).isCloseTo(2.0, within(0.04));
        }
    }

    @Test
    void rejectsNonPositiveTargetMean() {
        assertThatThrownBy(() -> generator.generate(10, 2, 0.0, 1.0, new Well19937c(1L)))
                .isInstanceOf(InvalidParameterException.class);
    }
}
