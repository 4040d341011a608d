package com.questrail.evgen.selector;

import com.questrail.evgen.generator.InteractionList;
import com.questrail.evgen.random.RandomService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Selects a candidate with probability proportional to its weight.
 *
 * <p>A negative or non-finite weight is logged and counted as zero. When every
 * candidate weighs zero nothing is selected.</p>
 */
public final class WeightedInteractionSelector extends AbstractInteractionSelector
{
    private static final Logger log = LoggerFactory.getLogger(WeightedInteractionSelector.class);

    private final InteractionWeigher weigher;

    public WeightedInteractionSelector(RandomService random, InteractionWeigher weigher) {
        super(random);
        this.weigher = Objects.requireNonNull(weigher, "weigher");
    }

    @Override
    protected OptionalInt drawIndex(InteractionList list) {
        int n = list.size();
        double[] cumulative = new double[n];
        double total = 0;
        int lastPositive = -1;

        for (int i = 0; i < n; i++) {
            double w = weigher.weight(list.get(i));
            if (!Double.isFinite(w) || w < 0) {
                log.warn("Ignoring invalid weight {} for {}", w, list.get(i).asString());
                w = 0;
            }
            if (w > 0) {
                lastPositive = i;
            }
            total += w;
            cumulative[i] = total;
        }

        if (lastPositive < 0) {
            return OptionalInt.empty();
        }

        double r = random.nextDouble() * total;
        for (int i = 0; i < n; i++) {
            if (r < cumulative[i]) {
                return OptionalInt.of(i);
            }
        }
        // rounding at the top edge
        return OptionalInt.of(lastPositive);
    }
}
