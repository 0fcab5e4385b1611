package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PopulationSliceTest {

    @Test
    void namesFollowPercentage() {
        assertThat(PopulationSlice.top(1.0)).isEqualTo(PopulationSlice.all());
        assertThat(PopulationSlice.top(0.1).name()).isEqualTo("top-10%");
        assertThat(PopulationSlice.top(0.01).name()).isEqualTo("top-1%");
        assertThat(PopulationSlice.top(0.005).name()).isEqualTo("top-0.5%");
    }

    @Test
    void memberCountRoundsUpAndNeverDropsBelowOne() {
        assertThat(PopulationSlice.top(0.1).memberCount(10_000)).isEqualTo(1_000);
        assertThat(PopulationSlice.top(0.01).memberCount(10_000)).isEqualTo(100);
        assertThat(PopulationSlice.top(0.01).memberCount(150)).isEqualTo(2);
        assertThat(PopulationSlice.top(0.01).memberCount(50)).isEqualTo(1);
        assertThat(PopulationSlice.all().memberCount(50)).isEqualTo(50);
    }

    @Test
    void rejectsFractionsOutsideUnitInterval() {
        assertThatThrownBy(() -> PopulationSlice.top(0.0)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> PopulationSlice.top(1.5)).isInstanceOf(InvalidParameterException.class);
    }
}
