package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AttributeMatrixTest {

    @Test
    void rejectsNonPositiveOrNonFiniteCells() {
        assertThatThrownBy(() -> AttributeMatrix.of(new double[][]{{1.0, 0.0}}))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("attribute[0][1]");
        assertThatThrownBy(() -> AttributeMatrix.of(new double[][]{{1.0, -2.0}}))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> AttributeMatrix.of(new double[][]{{Double.NaN}}))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> AttributeMatrix.of(new double[][]{{Double.POSITIVE_INFINITY}}))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void rejectsRaggedRows() {
        assertThatThrownBy(() -> AttributeMatrix.of(new double[][]{{1.0, 2.0}, {1.0}}))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void laterChangesToSourceArrayDoNotLeakIn() {
        double[][] source = {{1.0, 2.0}, {3.0, 4.0}};
        AttributeMatrix matrix = AttributeMatrix.of(source);

        source[0][0] = 100.0;
        matrix.row(1)[0] = 100.0;

        assertThat(matrix.get(0, 0)).isEqualTo(1.0);
        assertThat(matrix.get(1, 0)).isEqualTo(3.0);
        assertThat(matrix.column(1)).containsExactly(2.0, 4.0);
    }

    @Test
    void ratingSeriesRejectsNonPositiveRatings() {
        assertThatThrownBy(() -> RatingSeries.of(new double[]{1.0, 0.0}))
                .isInstanceOf(InvalidParameterException.class);
    }
}
