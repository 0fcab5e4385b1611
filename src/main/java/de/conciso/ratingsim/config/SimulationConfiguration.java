package de.conciso.ratingsim.config;

import de.conciso.ratingsim.model.CombinationRule;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.PopulationSlice;
import de.conciso.ratingsim.model.SimulationConfig;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Builds the {@link SimulationConfig} from {@code ratingsim.*} properties. List-valued
 * properties are comma separated.
 */
@Configuration
public class SimulationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SimulationConfiguration.class);

    @Bean
    public SimulationConfig simulationConfig(
            @Value("${ratingsim.population.size:10000}") int populationSize,
            @Value("${ratingsim.population.attributes:10}") int attributeCount,
            @Value("${ratingsim.population.mean:2}") double attributeMean,
            @Value("${ratingsim.population.sd:1}") double attributeSd,
            @Value("${ratingsim.noise.regimes:inverse-proportional,sqrt-proportional,constant-0.125,constant-0.25,constant-1}") String regimesStr,
            @Value("${ratingsim.truth.definitions:product,mixed}") String definitionsStr,
            @Value("${ratingsim.truth.mixed-weight:5}") double mixedWeight,
            @Value("${ratingsim.combination.rules:sum,product}") String rulesStr,
            @Value("${ratingsim.slices:1,0.1,0.01}") String slicesStr,
            @Value("${ratingsim.seed:13}") long seed
    ) {
        SimulationConfig config = new SimulationConfig(
                populationSize, attributeCount, attributeMean, attributeSd,
                split(regimesStr, NoiseRegime::parse),
                split(definitionsStr, TrueRatingDefinition::parse),
                mixedWeight,
                split(rulesStr, CombinationRule::parse),
                split(slicesStr, s -> PopulationSlice.top(Double.parseDouble(s))),
                seed);
        log.info("Simulation config: regimes={} definitions={} rules={} slices={}",
                config.regimes(), config.definitions(), config.rules(), config.slices());
        return config;
    }

    static <T> List<T> split(String csv, Function<String, T> parser) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(parser)
                .toList();
    }
}
