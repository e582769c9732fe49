package com.stockgame.leadership;

import com.stockgame.domain.enums.LeaderRole;
import com.stockgame.domain.enums.LeadershipPhase;
import com.stockgame.domain.enums.TurnLogResult;
import com.stockgame.domain.model.ExclusionStepResult;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.LeaderOpportunityGroup;
import com.stockgame.domain.model.LeadershipExclusionOpportunity;
import com.stockgame.domain.model.LeadershipExclusionStatus;
import com.stockgame.domain.model.LeadershipInfo;
import com.stockgame.domain.model.MarketEvent;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.StockLeadership;
import com.stockgame.domain.model.TurnAction;
import com.stockgame.domain.vo.OwnershipShare;
import com.stockgame.engine.GameInvariantChecker;
import com.stockgame.engine.RoundProcessor;
import com.stockgame.exception.BusinessException;
import com.stockgame.exception.GameStateException;
import com.stockgame.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the leadership-exclusion phase between the last turn of a round and its finalization.
 *
 * <p>Leaders act one at a time in the order stored on {@link LeadershipExclusionStatus}:
 * <ul>
 *   <li>A chairman may exclude any event of the round affecting a stock they chair.</li>
 *   <li>A director may exclude only events from their own hand affecting a stock they direct,
 *       and only while that stock has no chairman.</li>
 *   <li>Each led stock allows one exclusion per leader turn.</li>
 * </ul>
 *
 * <p>Moving past the last leader finalizes the round through {@link RoundProcessor}. All phase
 * progress lives on the game, so a reloaded game resumes where it stopped.
 */
@Service
public class LeadershipExclusionService {

    private static final Logger log = LoggerFactory.getLogger(LeadershipExclusionService.class);

    private final LeadershipCalculator leadershipCalculator;
    private final RoundProcessor roundProcessor;
    private final GameInvariantChecker invariantChecker;
    private final Clock clock;

    public LeadershipExclusionService(
            LeadershipCalculator leadershipCalculator,
            RoundProcessor roundProcessor,
            GameInvariantChecker invariantChecker,
            Clock clock) {
        this.leadershipCalculator = leadershipCalculator;
        this.roundProcessor = roundProcessor;
        this.invariantChecker = invariantChecker;
        this.clock = clock;
    }

    public void openPhase(GameState game, List<String> leaderIds) {
        invariantChecker.verifyLeaders(game, leaderIds, leadershipCalculator.collectLeaderIds(game.getStocks()));
        game.setLeadershipExclusionStatus(LeadershipExclusionStatus.builder()
                .phase(LeadershipPhase.ACTIVE)
                .round(game.getCurrentRound())
                .leaderIds(new ArrayList<>(leaderIds))
                .currentLeaderIndex(0)
                .totalLeaders(leaderIds.size())
                .completedLeaderIds(new ArrayList<>())
                .build());
        log.info("Game {}: leadership exclusion phase opened for round {} with leaders {}",
                game.getId(), game.getCurrentRound(), leaderIds);
    }

    /** Seat holders with the seats they hold, in leader order. */
    public List<LeadershipInfo> describeLeaders(GameState game, List<String> leaderIds) {
        List<LeadershipInfo> leaders = new ArrayList<>();
        for (String leaderId : leaderIds) {
            Player player = game.requirePlayer(leaderId);
            List<StockLeadership> seats = new ArrayList<>();
            for (Stock stock : game.getStocks()) {
                LeaderRole role = roleOf(stock, leaderId);
                if (role != null) {
                    seats.add(new StockLeadership(stock.getSymbol(), stock.getName(), role, sharePercentage(game, stock, leaderId)));
                }
            }
            leaders.add(new LeadershipInfo(leaderId, player.getName(), seats));
        }
        return leaders;
    }

    /** Every open exclusion opportunity of the current round. A stock's director is offered events only when it has no chairman. */
    public List<LeadershipExclusionOpportunity> getOpportunities(GameState game) {
        List<MarketEvent> candidates = roundProcessor.roundEvents(game).stream()
                .filter(e -> !e.isExcluded())
                .filter(e -> e.getRound() == game.getCurrentRound())
                .collect(Collectors.toList());

        List<LeadershipExclusionOpportunity> opportunities = new ArrayList<>();
        for (Stock stock : game.getStocks()) {
            List<MarketEvent> affecting = candidates.stream()
                    .filter(e -> e.affects(stock.getSymbol()))
                    .collect(Collectors.toList());
            if (affecting.isEmpty()) {
                continue;
            }
            if (stock.getChairmanId() != null) {
                Player chairman = game.requirePlayer(stock.getChairmanId());
                opportunities.add(new LeadershipExclusionOpportunity(
                        stock.getSymbol(), stock.getName(), chairman.getId(), chairman.getName(),
                        LeaderRole.CHAIRMAN, true, affecting));
            } else if (stock.getDirectorId() != null) {
                Player director = game.requirePlayer(stock.getDirectorId());
                List<MarketEvent> own = affecting.stream()
                        .filter(e -> director.getId().equals(e.getPlayerId()))
                        .collect(Collectors.toList());
                if (!own.isEmpty()) {
                    opportunities.add(new LeadershipExclusionOpportunity(
                            stock.getSymbol(), stock.getName(), director.getId(), director.getName(),
                            LeaderRole.DIRECTOR, false, own));
                }
            }
        }
        return opportunities;
    }

    /** Opportunities grouped per leader in phase order; leaders with nothing to exclude are omitted. */
    public List<LeaderOpportunityGroup> getOpportunitiesGrouped(GameState game) {
        LeadershipExclusionStatus status = requireActivePhase(game);
        List<LeadershipExclusionOpportunity> all = getOpportunities(game);
        List<LeaderOpportunityGroup> groups = new ArrayList<>();
        for (int i = 0; i < status.getLeaderIds().size(); i++) {
            String leaderId = status.getLeaderIds().get(i);
            List<LeadershipExclusionOpportunity> own = all.stream()
                    .filter(o -> o.getLeaderId().equals(leaderId))
                    .collect(Collectors.toList());
            if (!own.isEmpty()) {
                groups.add(new LeaderOpportunityGroup(
                        leaderId, own.get(0).getLeaderName(), i, status.getTotalLeaders(), own));
            }
        }
        return groups;
    }

    public void excludeEvent(GameState game, String eventId, String leaderId) {
        LeadershipExclusionStatus status = requireActivePhase(game);
        if (!status.currentLeaderId().equals(leaderId)) {
            throw new GameStateException(
                    "It is not this leader's turn to exclude events",
                    Map.of("currentLeader", status.currentLeaderId(), "attemptedLeader", leaderId));
        }
        MarketEvent event = roundProcessor.roundEvents(game).stream()
                .filter(e -> e.getId().equals(eventId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("MarketEvent", eventId));
        if (event.getRound() != game.getCurrentRound()) {
            throw new BusinessException(
                    "Event belongs to round " + event.getRound() + ", not the current round " + game.getCurrentRound());
        }
        if (event.isExcluded()) {
            throw new BusinessException("Event has already been excluded", Map.of("eventId", eventId));
        }

        String seatSymbol = null;
        LeaderRole seatRole = null;
        boolean ledAffectedStock = false;
        boolean directorOfOthersEvent = false;
        for (String symbol : event.getAffectedStocks()) {
            Stock stock = game.findStock(symbol).orElse(null);
            if (stock == null) {
                continue;
            }
            LeaderRole role = roleOf(stock, leaderId);
            if (role == null) {
                continue;
            }
            ledAffectedStock = true;
            if (role == LeaderRole.DIRECTOR && !leaderId.equals(event.getPlayerId())) {
                directorOfOthersEvent = true;
                continue;
            }
            if (exclusionSpent(game, leaderId, symbol)) {
                continue;
            }
            if (seatRole == null || (seatRole == LeaderRole.DIRECTOR && role == LeaderRole.CHAIRMAN)) {
                seatSymbol = symbol;
                seatRole = role;
            }
        }

        if (seatSymbol == null) {
            if (!ledAffectedStock) {
                throw new BusinessException(
                        "Player does not lead any stock affected by this event",
                        Map.of("leaderId", leaderId, "affectedStocks", event.getAffectedStocks()));
            }
            if (directorOfOthersEvent) {
                throw new BusinessException("Directors can only exclude events from their own hand");
            }
            throw new BusinessException("Exclusion already used for every stock this leader leads on this event");
        }

        event.setExcludedBy(leaderId);
        event.setExcludedForSymbol(seatSymbol);

        Player leader = game.requirePlayer(leaderId);
        String label = seatRole == LeaderRole.CHAIRMAN ? "Chairman" : "Director";
        leader.getActionHistory().add(TurnAction.builder()
                .round(game.getCurrentRound())
                .turn(game.getCurrentTurnInRound())
                .result(TurnLogResult.EVENT_EXCLUDED)
                .message(leader.getName() + " (" + label + ") excluded event: " + event.getTitle())
                .timestamp(Instant.now(clock))
                .build());
        log.info("Game {}: {} excluded event '{}' as {} of {}",
                game.getId(), leader.getName(), event.getTitle(), label, seatSymbol);
    }

    /** Marks the current leader done and moves on; past the last leader the round is finalized. */
    public ExclusionStepResult advanceToNextLeader(GameState game) {
        LeadershipExclusionStatus status = game.getLeadershipExclusionStatus();
        if (status == null) {
            throw GameStateException.leadershipPhaseNotActive(game.getId());
        }
        if (status.getPhase() == LeadershipPhase.COMPLETED) {
            return alreadyCompleted(game);
        }
        status.getCompletedLeaderIds().add(status.currentLeaderId());
        if (status.onLastLeader()) {
            return closePhase(game, status);
        }
        status.setCurrentLeaderIndex(status.getCurrentLeaderIndex() + 1);
        log.debug("Game {}: leader {} of {} now choosing", game.getId(),
                status.getCurrentLeaderIndex() + 1, status.getTotalLeaders());
        return ExclusionStepResult.builder()
                .completed(false)
                .nextLeaderIndex(status.getCurrentLeaderIndex())
                .build();
    }

    /** Finalizes the round from the last leader's turn. */
    public ExclusionStepResult completeRound(GameState game) {
        LeadershipExclusionStatus status = game.getLeadershipExclusionStatus();
        if (status == null) {
            throw GameStateException.leadershipPhaseNotActive(game.getId());
        }
        if (status.getPhase() == LeadershipPhase.COMPLETED) {
            return alreadyCompleted(game);
        }
        if (!status.onLastLeader()) {
            throw new GameStateException(
                    "Round can only be completed by the last leader",
                    Map.of("currentLeaderIndex", status.getCurrentLeaderIndex(), "totalLeaders", status.getTotalLeaders()));
        }
        if (!status.getCompletedLeaderIds().contains(status.currentLeaderId())) {
            status.getCompletedLeaderIds().add(status.currentLeaderId());
        }
        return closePhase(game, status);
    }

    private ExclusionStepResult closePhase(GameState game, LeadershipExclusionStatus status) {
        roundProcessor.finalizeRound(game);
        status.setPhase(LeadershipPhase.COMPLETED);
        log.info("Game {}: leadership exclusion phase for round {} completed", game.getId(), status.getRound());
        return ExclusionStepResult.builder()
                .completed(true)
                .roundEnded(true)
                .gameOver(game.isComplete())
                .build();
    }

    private ExclusionStepResult alreadyCompleted(GameState game) {
        return ExclusionStepResult.builder()
                .completed(true)
                .roundEnded(false)
                .gameOver(game.isComplete())
                .build();
    }

    private LeadershipExclusionStatus requireActivePhase(GameState game) {
        if (!game.leadershipPhaseActive()) {
            throw GameStateException.leadershipPhaseNotActive(game.getId());
        }
        return game.getLeadershipExclusionStatus();
    }

    private boolean exclusionSpent(GameState game, String leaderId, String symbol) {
        return roundProcessor.roundEvents(game).stream()
                .anyMatch(e -> leaderId.equals(e.getExcludedBy()) && symbol.equals(e.getExcludedForSymbol()));
    }

    /** Seat carrying exclusion rights. A director has none while the stock has a chairman. */
    private static LeaderRole roleOf(Stock stock, String playerId) {
        if (playerId.equals(stock.getChairmanId())) {
            return LeaderRole.CHAIRMAN;
        }
        if (stock.getChairmanId() == null && playerId.equals(stock.getDirectorId())) {
            return LeaderRole.DIRECTOR;
        }
        return null;
    }

    private BigDecimal sharePercentage(GameState game, Stock stock, String playerId) {
        return leadershipCalculator.calculateOwnership(game.getPlayers(), stock.getSymbol(), stock.getTotalQuantity())
                .stream()
                .filter(o -> o.getPlayerId().equals(playerId))
                .map(OwnershipShare::getPercentage)
                .findFirst()
                .orElse(BigDecimal.ZERO)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
