package com.stockgame.exception;

import java.util.Map;

/**
 * Raised when a request arrives out of sequence: acting out of turn, ending a turn while the
 * leadership-exclusion phase is open, or advancing a game that has already finished.
 *
 * <p>Always thrown before any mutation, so the stored game is untouched.
 */
public class GameStateException extends BaseException {

    public GameStateException(String message) {
        super(ErrorCode.GAME_STATE_ERROR, message);
    }

    public GameStateException(String message, Map<String, Object> details) {
        super(ErrorCode.GAME_STATE_ERROR, message, details);
    }

    public static GameStateException gameComplete(String gameId) {
        return new GameStateException("Game is already complete", Map.of("gameId", gameId));
    }

    public static GameStateException notPlayerTurn(String currentPlayerId, String attemptedPlayerId) {
        return new GameStateException(
                "Not your turn", Map.of("currentPlayer", currentPlayerId, "attemptedPlayer", attemptedPlayerId));
    }

    public static GameStateException leadershipPhaseActive(String gameId) {
        return new GameStateException(
                "Leadership exclusion phase is in progress; finish it before continuing", Map.of("gameId", gameId));
    }

    public static GameStateException leadershipPhaseNotActive(String gameId) {
        return new GameStateException("Leadership exclusion phase is not active", Map.of("gameId", gameId));
    }
}
