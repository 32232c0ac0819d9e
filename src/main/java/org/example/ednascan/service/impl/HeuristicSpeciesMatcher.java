package org.example.ednascan.service.impl;

import org.example.ednascan.model.SequenceRecord;
import org.example.ednascan.model.Species;
import org.example.ednascan.model.SpeciesCategory;
import org.example.ednascan.model.SpeciesMatch;
import org.example.ednascan.service.SpeciesMatcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Random base score in [0.4, 0.7), +0.2 inside the category's GC band, +0.1 for a plausible
 * amplicon length, capped at 0.95. Ties keep the first catalog entry.
 */
@Service
public class HeuristicSpeciesMatcher implements SpeciesMatcher {

    static final double BASE_MIN = 0.4;
    static final double BASE_SPAN = 0.3;
    static final double GC_BONUS = 0.2;
    static final double LENGTH_BONUS = 0.1;
    static final double MAX_CONFIDENCE = 0.95;
    static final int MIN_AMPLICON_LENGTH = 200;
    static final int MAX_AMPLICON_LENGTH = 1000;

    private static final Map<SpeciesCategory, double[]> GC_BANDS = new EnumMap<>(SpeciesCategory.class);

    static {
        GC_BANDS.put(SpeciesCategory.FISH, new double[]{0.45, 0.55});
        GC_BANDS.put(SpeciesCategory.CORAL, new double[]{0.38, 0.48});
        GC_BANDS.put(SpeciesCategory.ALGAE, new double[]{0.35, 0.45});
    }

    private final Random random;

    public HeuristicSpeciesMatcher(@Qualifier("matcherRandom") Random random) {
        this.random = random;
    }

    @Override
    public Optional<SpeciesMatch> match(SequenceRecord record, List<Species> catalog) {
        if (catalog == null || catalog.isEmpty()) {
            return Optional.empty();
        }

        double gc = record.gcContent();
        int length = record.length();

        Species best = null;
        double bestScore = 0.0;
        for (Species species : catalog) {
            double score = score(species.getCategory(), gc, length);
            if (score > ACCEPTANCE_FLOOR && score > bestScore) {
                best = species;
                bestScore = score;
            }
        }
        return best == null ? Optional.empty() : Optional.of(new SpeciesMatch(best, bestScore));
    }

    double score(SpeciesCategory category, double gc, int length) {
        double score = BASE_MIN + random.nextDouble() * BASE_SPAN;

        double[] band = category == null ? null : GC_BANDS.get(category);
        if (band != null && gc > band[0] && gc < band[1]) {
            score += GC_BONUS;
        }
        if (length > MIN_AMPLICON_LENGTH && length < MAX_AMPLICON_LENGTH) {
            score += LENGTH_BONUS;
        }
        return Math.min(score, MAX_CONFIDENCE);
    }
}
