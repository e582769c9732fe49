package com.stockgame.api.controller;

import com.stockgame.api.dto.request.CreateGameRequest;
import com.stockgame.api.dto.request.TradeActionRequest;
import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.CorporateActionPreview;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.PlayerRanking;
import com.stockgame.domain.model.PortfolioSummary;
import com.stockgame.domain.model.TradeResult;
import com.stockgame.domain.model.TradeValidation;
import com.stockgame.domain.model.TurnResult;
import com.stockgame.service.GameService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for game lifecycle, player actions and read-only game views.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/games                                   - Start a game</li>
 *   <li>GET  /api/games/{gameId}                          - Full game state</li>
 *   <li>DELETE /api/games/{gameId}                        - Drop a finished or abandoned game</li>
 *   <li>POST /api/games/{gameId}/actions                  - Execute the current player's action</li>
 *   <li>POST /api/games/{gameId}/end-turn                 - Pass to the next seat</li>
 *   <li>GET  /api/games/{gameId}/validate-trade           - Dry-run a BUY or SELL</li>
 *   <li>GET  /api/games/{gameId}/portfolio                - Holdings and net worth</li>
 *   <li>GET  /api/games/{gameId}/rankings                 - Players by net worth</li>
 *   <li>GET  /api/games/{gameId}/rights-issues            - Open rights issues for the current player</li>
 *   <li>GET  /api/games/{gameId}/corporate-actions        - Unplayed cards of the current player</li>
 *   <li>GET  /api/games/{gameId}/corporate-actions/{id}/preview - Effect of playing a card</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/games")
public class GameController {

    private static final Logger log = LoggerFactory.getLogger(GameController.class);

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    @PostMapping
    public ResponseEntity<GameState> createGame(@Valid @RequestBody CreateGameRequest request) {
        GameState game = gameService.createGame(request.getPlayerNames(), request.getMaxRounds());
        log.info("Created game {} with {} players", game.getId(), game.getPlayers().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(game);
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameState> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getGameState(gameId));
    }

    @DeleteMapping("/{gameId}")
    public ResponseEntity<Void> deleteGame(@PathVariable String gameId) {
        gameService.deleteGame(gameId);
        return ResponseEntity.noContent().build();
    }

    /** Rule failures come back as 200 with {@code success=false}; sequencing errors as 409. */
    @PostMapping("/{gameId}/actions")
    public ResponseEntity<TradeResult> executeAction(
            @PathVariable String gameId, @Valid @RequestBody TradeActionRequest request) {
        TradeResult result = gameService.executeAction(gameId, request.toTradeAction(), request.getPlayerId());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/{gameId}/end-turn")
    public ResponseEntity<TurnResult> endTurn(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.endTurn(gameId));
    }

    @GetMapping("/{gameId}/validate-trade")
    public ResponseEntity<TradeValidation> validateTrade(
            @PathVariable String gameId,
            @RequestParam ActionType type,
            @RequestParam String symbol,
            @RequestParam int quantity) {
        return ResponseEntity.ok(gameService.validateTrade(gameId, type, symbol, quantity));
    }

    @GetMapping("/{gameId}/portfolio")
    public ResponseEntity<PortfolioSummary> getPortfolio(
            @PathVariable String gameId, @RequestParam(required = false) String playerId) {
        return ResponseEntity.ok(gameService.getPortfolio(gameId, playerId));
    }

    @GetMapping("/{gameId}/rankings")
    public ResponseEntity<List<PlayerRanking>> getRankings(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getPlayerRankings(gameId));
    }

    @GetMapping("/{gameId}/rights-issues")
    public ResponseEntity<List<CorporateAction>> getActiveRightsIssues(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getActiveRightsIssues(gameId));
    }

    @GetMapping("/{gameId}/corporate-actions")
    public ResponseEntity<List<CorporateAction>> getUnplayedCorporateActions(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getUnplayedCorporateActions(gameId));
    }

    @GetMapping("/{gameId}/corporate-actions/{corporateActionId}/preview")
    public ResponseEntity<CorporateActionPreview> previewCorporateAction(
            @PathVariable String gameId,
            @PathVariable String corporateActionId,
            @RequestParam String symbol) {
        return ResponseEntity.ok(gameService.getCorporateActionPreview(gameId, corporateActionId, symbol));
    }
}
