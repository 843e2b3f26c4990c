package com.surveyflow.runtime.ordering;

import com.surveyflow.runtime.config.RuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Source of randomness for every shuffle in the runtime.
 * <p>
 * Shuffles that belong to a session draw from a generator seeded by the session id and the entity
 * being shuffled, so the same session reproduces the same order even after its order cache is lost.
 * {@code survey.runtime.shuffle-seed}, when configured, is mixed into those seeds and also seeds the
 * generator used outside sessions.
 */
@Component
public class Shuffler {
    private static final Logger log = LoggerFactory.getLogger(Shuffler.class);

    private final Random random;
    private final long baseSeed;

    @Autowired
    public Shuffler(RuntimeProperties properties) {
        Long seed = properties.getShuffleSeed();
        if (seed != null) {
            log.info("Shuffles use fixed seed {}", seed);
            this.random = new Random(seed);
            this.baseSeed = seed;
        } else {
            this.random = new Random();
            this.baseSeed = 0L;
        }
    }

    public Shuffler(Random random) {
        this.random = random;
        this.baseSeed = 0L;
    }

    /**
     * Generator for one session and entity. Without a session id the shared generator is returned.
     */
    public Random random(String sessionId, String entity) {
        if (sessionId == null) return random;
        long hash = 0L;
        for (char c : (sessionId + "|" + entity).toCharArray()) {
            hash = 31 * hash + c;
        }
        return new Random(mix(hash ^ baseSeed));
    }

    /**
     * Unbiased Fisher-Yates over a copy of {@code items}.
     */
    public <T> List<T> shuffle(List<T> items, Random source) {
        List<T> copy = new ArrayList<>(items);
        for (int i = copy.size() - 1; i > 0; i--) {
            int j = source.nextInt(i + 1);
            T tmp = copy.get(i);
            copy.set(i, copy.get(j));
            copy.set(j, tmp);
        }
        return copy;
    }

    // Close seeds from java.util.Random start with correlated draws; spread them first.
    private static long mix(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
