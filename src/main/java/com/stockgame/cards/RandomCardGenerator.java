package com.stockgame.cards;

import com.stockgame.config.GameConfig;
import com.stockgame.domain.enums.CorporateActionType;
import com.stockgame.domain.enums.MarketEventType;
import com.stockgame.domain.enums.RightIssueStatus;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.CorporateActionDetails;
import com.stockgame.domain.model.MarketEvent;
import com.stockgame.market.EventTemplate;
import com.stockgame.market.MarketEventCatalog;
import com.stockgame.market.MarketEventRules;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deals hands from {@link MarketEventCatalog} using an injected {@link Random}.
 *
 * <p>Each hand has {@code cardsPerPlayer} cards, {@code floor(cardsPerPlayer *
 * corporateActionPercentage)} of them corporate actions, in shuffled order. Event templates are
 * drawn weighted by severity and not repeated until the deck is exhausted within one deal. From
 * {@code rareEventMinRound} on, any event card may instead be a sector crash or bull run.
 *
 * <p>All randomness, ids included, comes from the injected source, so a seeded {@link Random}
 * reproduces the deal exactly.
 */
@Component
public class RandomCardGenerator implements CardGenerator {

    private static final Logger log = LoggerFactory.getLogger(RandomCardGenerator.class);

    private static final BigDecimal CRASH_IMPACT = new BigDecimal("-35");
    private static final BigDecimal BULL_RUN_IMPACT = new BigDecimal("35");

    private final GameConfig gameConfig;
    private final MarketEventRules marketEventRules;
    private final Random random;

    public RandomCardGenerator(GameConfig gameConfig, MarketEventRules marketEventRules, Random random) {
        this.gameConfig = gameConfig;
        this.marketEventRules = marketEventRules;
        this.random = random;
    }

    @Override
    public synchronized List<CardHand> dealHands(int round, int playerCount) {
        Set<String> usedTemplates = new HashSet<>();
        List<CardHand> hands = new ArrayList<>();
        for (int p = 0; p < playerCount; p++) {
            hands.add(dealHand(round, usedTemplates));
        }
        log.debug("Dealt {} hands for round {}", playerCount, round);
        return hands;
    }

    private CardHand dealHand(int round, Set<String> usedTemplates) {
        int cards = gameConfig.getCardsPerPlayer();
        int corporateCount = (int) Math.floor(cards * gameConfig.getCorporateActionPercentage());
        List<Boolean> isCorporate = new ArrayList<>();
        for (int i = 0; i < cards; i++) {
            isCorporate.add(i < corporateCount);
        }
        Collections.shuffle(isCorporate, random);

        List<MarketEvent> events = new ArrayList<>();
        List<CorporateAction> corporateActions = new ArrayList<>();
        for (Boolean corporate : isCorporate) {
            if (corporate) {
                corporateActions.add(drawCorporateAction(round));
            } else {
                events.add(drawEvent(round, usedTemplates));
            }
        }
        return new CardHand(events, corporateActions);
    }

    private MarketEvent drawEvent(int round, Set<String> usedTemplates) {
        if (round >= gameConfig.getRareEventMinRound()) {
            if (random.nextDouble() < gameConfig.getRareEventProbability()) {
                return rareEvent(round, MarketEventType.CRASH);
            }
            if (random.nextDouble() < gameConfig.getRareEventProbability()) {
                return rareEvent(round, MarketEventType.BULL_RUN);
            }
        }

        List<EventTemplate> available = MarketEventCatalog.templates().stream()
                .filter(t -> !usedTemplates.contains(t.getKey()))
                .filter(t -> t.getType().isCashEvent() || !symbolsFor(t.getSectors()).isEmpty())
                .collect(Collectors.toList());
        if (available.isEmpty()) {
            usedTemplates.clear();
            available = MarketEventCatalog.templates().stream()
                    .filter(t -> t.getType().isCashEvent() || !symbolsFor(t.getSectors()).isEmpty())
                    .collect(Collectors.toList());
        }

        int totalWeight = 0;
        for (EventTemplate template : available) {
            totalWeight += marketEventRules.eventWeight(marketEventRules.computeEventSeverity(template.getImpact()));
        }
        int pick = random.nextInt(totalWeight);
        EventTemplate chosen = available.get(available.size() - 1);
        for (EventTemplate template : available) {
            pick -= marketEventRules.eventWeight(marketEventRules.computeEventSeverity(template.getImpact()));
            if (pick < 0) {
                chosen = template;
                break;
            }
        }
        usedTemplates.add(chosen.getKey());

        return MarketEvent.builder()
                .id(nextId())
                .type(chosen.getType())
                .severity(marketEventRules.computeEventSeverity(chosen.getImpact()))
                .title(chosen.getTitle())
                .description(chosen.getDescription())
                .affectedStocks(symbolsFor(chosen.getSectors()))
                .impact(chosen.getImpact())
                .round(round)
                .build();
    }

    private MarketEvent rareEvent(int round, MarketEventType type) {
        List<String> sectors = gameConfig.getStocks().stream()
                .map(GameConfig.StockDefinition::getSector)
                .distinct()
                .collect(Collectors.toList());
        String sector = sectors.get(random.nextInt(sectors.size()));
        boolean crash = type == MarketEventType.CRASH;
        BigDecimal impact = crash ? CRASH_IMPACT : BULL_RUN_IMPACT;
        String title = sector.toUpperCase(Locale.ROOT) + (crash ? " SECTOR CRASH!" : " BULL RUN!");
        String description = crash
                ? "Panic selling triggers massive collapse in " + sector + " sector"
                : "Massive investor optimism drives unprecedented rally in " + sector + " sector";
        return MarketEvent.builder()
                .id(nextId())
                .type(type)
                .severity(marketEventRules.computeEventSeverity(impact))
                .title(title)
                .description(description)
                .affectedStocks(symbolsFor(List.of(sector)))
                .impact(impact)
                .round(round)
                .build();
    }

    private CorporateAction drawCorporateAction(int round) {
        CorporateActionType[] types = CorporateActionType.values();
        CorporateActionType type = types[random.nextInt(types.length)];
        CorporateAction.CorporateActionBuilder builder =
                CorporateAction.builder().id(nextId()).type(type).round(round).played(false);
        switch (type) {
            case DIVIDEND:
                BigDecimal dividend = gameConfig.getDividendPercentage();
                return builder.title("Declare Dividend")
                        .description("Announce dividend payout to shareholders of selected stock ("
                                + percent(dividend) + "% of stock price)")
                        .details(CorporateActionDetails.dividend(dividend))
                        .build();
            case RIGHT_ISSUE:
                BigDecimal discount = gameConfig.getRightIssueDiscount();
                return builder.title("Announce Right Issue")
                        .description("Offer new shares to existing shareholders at "
                                + percent(BigDecimal.ONE.subtract(discount)) + "% discount ("
                                + gameConfig.getRightIssueRatio() + ":" + gameConfig.getRightIssueBaseShares()
                                + " ratio)")
                        .details(CorporateActionDetails.rightIssue(
                                gameConfig.getRightIssueRatio(), gameConfig.getRightIssueBaseShares(), discount))
                        .status(RightIssueStatus.PENDING)
                        .build();
            case BONUS_ISSUE:
            default:
                return builder.title("Announce Bonus Issue")
                        .description("Issue bonus shares to existing shareholders ("
                                + gameConfig.getBonusRatio() + ":" + gameConfig.getBonusBaseShares() + " ratio)")
                        .details(CorporateActionDetails.bonusIssue(
                                gameConfig.getBonusRatio(), gameConfig.getBonusBaseShares()))
                        .build();
        }
    }

    private List<String> symbolsFor(List<String> sectors) {
        return gameConfig.getStocks().stream()
                .filter(s -> sectors.contains(s.getSector()))
                .map(GameConfig.StockDefinition::getSymbol)
                .collect(Collectors.toList());
    }

    private String nextId() {
        return new UUID(random.nextLong(), random.nextLong()).toString();
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(new BigDecimal("100")).stripTrailingZeros().toPlainString();
    }
}
