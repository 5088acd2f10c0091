package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.model.Label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded, label-stratified train/validation split.
 *
 * <p>
 * Each class is shuffled on its own and {@code round(n_c * fraction)} of its
 * rows go to validation, capped so that every class keeps at least one
 * training row. Both index arrays come back in ascending order.
 * </p>
 */
final class StratifiedSplitter {

    private final double validationFraction;
    private final long seed;

    StratifiedSplitter(double validationFraction, long seed) {
        if (!(validationFraction > 0 && validationFraction < 1)) {
            throw new IllegalArgumentException("validationFraction must lie in (0, 1), got: " + validationFraction);
        }
        this.validationFraction = validationFraction;
        this.seed = seed;
    }

    Split split(int[] labels) {
        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> validation = new ArrayList<>();
        for (int label : new int[] { Label.NORMAL.value(), Label.ANOMALOUS.value() }) {
            List<Integer> members = new ArrayList<>();
            for (int i = 0; i < labels.length; i++) {
                if (labels[i] == label) {
                    members.add(i);
                }
            }
            Collections.shuffle(members, random);
            int held = (int) Math.min(Math.round(members.size() * validationFraction),
                    Math.max(0, members.size() - 1));
            validation.addAll(members.subList(0, held));
            train.addAll(members.subList(held, members.size()));
        }
        return new Split(sorted(train), sorted(validation));
    }

    private static int[] sorted(List<Integer> indices) {
        return indices.stream().mapToInt(Integer::intValue).sorted().toArray();
    }

    static final class Split {
        final int[] train;
        final int[] validation;

        Split(int[] train, int[] validation) {
            this.train = train;
            this.validation = validation;
        }
    }
}
