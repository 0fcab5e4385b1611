package de.conciso.ratingsim.service;

import de.conciso.ratingsim.model.AttributeMatrix;
import de.conciso.ratingsim.model.RatingSeries;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class GroundTruthComposer {

    public RatingSeries compose(AttributeMatrix attributes, TrueRatingDefinition definition, double mixedWeight) {
        double[] ratings = new double[attributes.entities()];
        for (int i = 0; i < ratings.length; i++) {
            ratings[i] = definition.rate(attributes.row(i), mixedWeight);
        }
        return RatingSeries.of(ratings);
    }

    /**
     * All definitions are computed from the same matrix, so they describe the same population.
     */
    public Map<TrueRatingDefinition, RatingSeries> composeAll(AttributeMatrix attributes,
                                                             List<TrueRatingDefinition> definitions,
                                                             double mixedWeight) {
        Map<TrueRatingDefinition, RatingSeries> truths = new LinkedHashMap<>();
        for (TrueRatingDefinition definition : definitions) {
            truths.put(definition, compose(attributes, definition, mixedWeight));
        }
        return truths;
    }
}
