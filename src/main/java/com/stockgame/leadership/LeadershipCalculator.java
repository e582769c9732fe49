package com.stockgame.leadership;

import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.vo.LeadershipResult;
import com.stockgame.domain.vo.OwnershipShare;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Derives chairman and director seats from share ownership.
 *
 * <p>A chairman holds at least {@code chairmanThreshold} of the issued cap, a director at least
 * {@code directorThreshold} and is never the chairman. The largest qualifying holder wins a seat,
 * except that a sitting holder tied at the top keeps it. Results depend only on the inputs, so
 * calling twice with the same ownership gives the same seats.
 */
@Service
public class LeadershipCalculator {

    /** Precise enough that a holder one share short of a threshold never rounds up into it. */
    private static final int PERCENT_SCALE = 8;

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    /** Ownership of every player, largest first. Equal quantities keep player order. */
    public List<OwnershipShare> calculateOwnership(List<Player> players, String symbol, int totalIssued) {
        List<OwnershipShare> ownership = new ArrayList<>();
        for (Player player : players) {
            int quantity = player.heldQuantity(symbol);
            BigDecimal percentage = totalIssued > 0
                    ? BigDecimal.valueOf(quantity)
                            .multiply(HUNDRED)
                            .divide(BigDecimal.valueOf(totalIssued), PERCENT_SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            ownership.add(new OwnershipShare(player.getId(), quantity, percentage));
        }
        // List.sort is stable
        ownership.sort(Comparator.comparingInt(OwnershipShare::getQuantity).reversed());
        return ownership;
    }

    public String determineChairman(List<OwnershipShare> ownership, String currentChairmanId, BigDecimal threshold) {
        return determineSeat(ownership, currentChairmanId, null, threshold);
    }

    public String determineDirector(
            List<OwnershipShare> ownership, String currentDirectorId, String chairmanId, BigDecimal threshold) {
        return determineSeat(ownership, currentDirectorId, chairmanId, threshold);
    }

    public LeadershipResult calculateLeadership(
            List<Player> players,
            String symbol,
            int totalIssued,
            String currentChairmanId,
            String currentDirectorId,
            BigDecimal chairmanThreshold,
            BigDecimal directorThreshold) {
        List<OwnershipShare> ownership = calculateOwnership(players, symbol, totalIssued);
        String chairmanId = determineChairman(ownership, currentChairmanId, chairmanThreshold);
        String directorId = determineDirector(ownership, currentDirectorId, chairmanId, directorThreshold);
        return new LeadershipResult(chairmanId, directorId);
    }

    /** Recomputes and stores the seats of every stock. */
    public void refreshLeadership(
            List<Player> players, List<Stock> stocks, BigDecimal chairmanThreshold, BigDecimal directorThreshold) {
        for (Stock stock : stocks) {
            LeadershipResult result = calculateLeadership(
                    players,
                    stock.getSymbol(),
                    stock.getTotalQuantity(),
                    stock.getChairmanId(),
                    stock.getDirectorId(),
                    chairmanThreshold,
                    directorThreshold);
            stock.setChairmanId(result.getChairmanId());
            stock.setDirectorId(result.getDirectorId());
        }
    }

    /**
     * Distinct players with exclusion rights in stock order, first occurrence wins. A director
     * counts only on stocks without a chairman.
     */
    public List<String> collectLeaderIds(List<Stock> stocks) {
        Set<String> leaders = new LinkedHashSet<>();
        for (Stock stock : stocks) {
            if (stock.getChairmanId() != null) {
                leaders.add(stock.getChairmanId());
            } else if (stock.getDirectorId() != null) {
                leaders.add(stock.getDirectorId());
            }
        }
        return new ArrayList<>(leaders);
    }

    private String determineSeat(
            List<OwnershipShare> ownership, String currentHolderId, String excludedId, BigDecimal threshold) {
        BigDecimal thresholdPercent = threshold.multiply(HUNDRED);
        List<OwnershipShare> qualifying = ownership.stream()
                .filter(o -> o.getQuantity() > 0)
                .filter(o -> o.getPercentage().compareTo(thresholdPercent) >= 0)
                .filter(o -> !Objects.equals(o.getPlayerId(), excludedId))
                .collect(Collectors.toList());
        if (qualifying.isEmpty()) {
            return null;
        }
        int highest = qualifying.get(0).getQuantity();
        if (currentHolderId != null) {
            boolean holderTiedAtTop = qualifying.stream()
                    .anyMatch(o -> o.getQuantity() == highest && o.getPlayerId().equals(currentHolderId));
            if (holderTiedAtTop) {
                return currentHolderId;
            }
        }
        return qualifying.get(0).getPlayerId();
    }
}
