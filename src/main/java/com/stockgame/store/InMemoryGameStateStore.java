package com.stockgame.store;

import com.stockgame.domain.model.GameState;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Keeps each game as a JSON snapshot in memory. Serializing on save and deserializing on load
 * gives every caller its own copy, so a mutation that fails halfway is never visible.
 */
@Repository
public class InMemoryGameStateStore implements GameStateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGameStateStore.class);

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<GameState> load(String gameId) {
        return Optional.ofNullable(snapshots.get(gameId)).map(json -> JsonHelper.fromJson(json, GameState.class));
    }

    @Override
    public void save(GameState game) {
        game.setVersion(game.getVersion() + 1);
        snapshots.put(game.getId(), JsonHelper.toJson(game));
        log.debug("Saved game {} at version {}", game.getId(), game.getVersion());
    }

    @Override
    public void delete(String gameId) {
        snapshots.remove(gameId);
    }

    @Override
    public List<String> findAllIds() {
        return new ArrayList<>(snapshots.keySet());
    }
}
