package com.stockgame.store;

import com.stockgame.domain.model.GameState;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for whole games. Each call is atomic. {@link #load} returns a private
 * copy, so changes made to it are invisible to other callers until {@link #save} commits them.
 */
public interface GameStateStore {

    Optional<GameState> load(String gameId);

    void save(GameState game);

    void delete(String gameId);

    List<String> findAllIds();
}
