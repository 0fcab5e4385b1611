package de.conciso.ratingsim.model;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Location and scale of the normal distribution in log space. Exponentiating a draw
 * gives a linear-scale variate with the mean and sd the parameters were matched to.
 */
public record LogNormalParameters(double location, double scale) {

    public double sample(RandomGenerator random) {
        return Math.exp(location + scale * random.nextGaussian());
    }
}
