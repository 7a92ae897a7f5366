package io.bdrc.catalogsync.scores;

import java.util.Optional;

@FunctionalInterface
public interface ScoreProvider {
    Optional<Double> scoreFor(String id);
}
