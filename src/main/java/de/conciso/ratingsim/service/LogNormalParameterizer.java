package de.conciso.ratingsim.service;

import de.conciso.ratingsim.exception.InvalidParameterException;
import de.conciso.ratingsim.model.LogNormalParameters;
import org.springframework.stereotype.Component;

/**
 * Moment matching from a linear-scale (mean, sd) to the log-space normal whose
 * exponential has exactly that mean and sd.
 *
 * <pre>
 *   location = ln(m^2 / sqrt(s^2 + m^2))
 *   scale    = sqrt(ln(1 + s^2 / m^2))
 * </pre>
 *
 * An sd of zero is accepted and yields scale 0, i.e. every sample equals the mean.
 */
@Component
public class LogNormalParameterizer {

    public LogNormalParameters parameterize(double mean, double sd) {
        if (!(mean > 0.0) || Double.isInfinite(mean)) {
            throw InvalidParameterException.of("mean", mean, "a finite value > 0");
        }
        if (!(sd >= 0.0) || Double.isInfinite(sd)) {
            throw InvalidParameterException.of("sd", sd, "a finite value >= 0");
        }
        double variance = sd * sd;
        double meanSq = mean * mean;
        double location = Math.log(meanSq / Math.sqrt(variance + meanSq));
        double scale = Math.sqrt(Math.log1p(variance / meanSq));
        return new LogNormalParameters(location, scale);
    }
}
