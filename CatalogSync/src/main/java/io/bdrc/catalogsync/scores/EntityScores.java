package io.bdrc.catalogsync.scores;

import java.util.Map;
import java.util.Optional;

/**
 * Popularity scores keyed by resource id, loaded once per process.
 */
public class EntityScores implements ScoreProvider {
    private final Map<String, Double> scores;

    public EntityScores(Map<String, Double> scores) {
        this.scores = Map.copyOf(scores);
    }

    public static EntityScores empty() {
        return new EntityScores(Map.of());
    }

    @Override
    public Optional<Double> scoreFor(String id) {
        return Optional.ofNullable(scores.get(id));
    }

    public int size() {
        return scores.size();
    }
}
