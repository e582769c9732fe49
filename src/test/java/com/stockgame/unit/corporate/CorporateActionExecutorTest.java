package com.stockgame.unit.corporate;

import static org.assertj.core.api.Assertions.assertThat;

import com.stockgame.corporate.CorporateActionCalculator;
import com.stockgame.corporate.CorporateActionExecutor;
import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.enums.CorporateActionType;
import com.stockgame.domain.enums.RightIssueStatus;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.CorporateActionDetails;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.StockHolding;
import com.stockgame.domain.model.TradeAction;
import com.stockgame.domain.model.TradeResult;
import com.stockgame.trading.TradeCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CorporateActionExecutor.
 *
 * <p>Verifies: dividend and bonus plays against all holders, the two-step rights issue,
 * supply accounting and that rejected plays leave the card and balances untouched.
 *
 * <p>Fixture: Alice holds 100 TECH, Bob 50, Cara none. TECH trades at 110.
 */
class CorporateActionExecutorTest {

    private CorporateActionExecutor executor;
    private GameState game;
    private Player alice;
    private Player bob;
    private Player cara;
    private Stock tech;

    @BeforeEach
    void setUp() {
        executor = new CorporateActionExecutor(
                new CorporateActionCalculator(),
                new TradeCalculator(),
                Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC));
        alice = player("a", "Alice", 100);
        bob = player("b", "Bob", 50);
        cara = player("c", "Cara", 0);
        tech = Stock.builder()
                .symbol("TECH")
                .name("TechCorp")
                .price(new BigDecimal("110.00"))
                .availableQuantity(200_000 - 150)
                .totalQuantity(200_000)
                .build();
        game = GameState.builder()
                .id("g1")
                .currentRound(1)
                .currentTurnInRound(1)
                .players(new ArrayList<>(List.of(alice, bob, cara)))
                .stocks(new ArrayList<>(List.of(tech)))
                .build();
    }

    @Nested
    @DisplayName("Dividend")
    class Dividend {

        @Test
        void paysEveryHolder() {
            CorporateAction card = give(alice, "ca-div", CorporateActionDetails.dividend(new BigDecimal("0.05")));

            TradeResult result = executor.playCorporateAction(game, alice, play("ca-div", "TECH", null));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).isEqualTo("Dividend declared for TechCorp. Paid $825.00 to 2 shareholders.");
            assertThat(alice.getCash()).isEqualByComparingTo("1550.00");
            assertThat(bob.getCash()).isEqualByComparingTo("1275.00");
            assertThat(cara.getCash()).isEqualByComparingTo("1000.00");
            assertThat(card.isPlayed()).isTrue();
            assertThat(card.getSymbol()).isEqualTo("TECH");
            assertThat(card.getPlayersProcessed()).containsExactly("a");
            // headline plus one toast per recipient
            assertThat(result.getToasts()).hasSize(3);
        }

        @Test
        void playedCard_cannotBePlayedAgain() {
            give(alice, "ca-div", CorporateActionDetails.dividend(new BigDecimal("0.05")));
            executor.playCorporateAction(game, alice, play("ca-div", "TECH", null));

            TradeResult again = executor.playCorporateAction(game, alice, play("ca-div", "TECH", null));

            assertThat(again.isSuccess()).isFalse();
            assertThat(again.getMessage()).isEqualTo("Corporate action not found or already played");
            assertThat(alice.getCash()).isEqualByComparingTo("1550.00");
        }
    }

    @Test
    void missingIds_areRejectedWithoutMutation() {
        CorporateAction card = give(alice, "ca-div", CorporateActionDetails.dividend(new BigDecimal("0.05")));

        assertThat(executor.playCorporateAction(game, alice, play(null, "TECH", null)).getMessage())
                .isEqualTo("Corporate action ID required");
        assertThat(executor.playCorporateAction(game, alice, play("ca-div", null, null)).getMessage())
                .isEqualTo("Stock symbol required for corporate action");
        assertThat(executor.playCorporateAction(game, alice, play("ca-div", "NOPE", null)).getMessage())
                .isEqualTo("Stock not found");
        assertThat(card.isPlayed()).isFalse();
    }

    @Test
    void bonusIssue_growsHoldingsFromFreeSupply() {
        give(alice, "ca-bonus", CorporateActionDetails.bonusIssue(1, 5));

        TradeResult result = executor.playCorporateAction(game, alice, play("ca-bonus", "TECH", null));

        assertThat(result.getMessage()).isEqualTo("Bonus issue declared for TechCorp. Issued 30 shares to 2 shareholders.");
        assertThat(alice.heldQuantity("TECH")).isEqualTo(120);
        assertThat(bob.heldQuantity("TECH")).isEqualTo(60);
        assertThat(alice.findHolding("TECH").orElseThrow().getAverageCost()).isEqualByComparingTo("83.33");
        assertThat(tech.getAvailableQuantity()).isEqualTo(200_000 - 180);
        assertThat(alice.heldQuantity("TECH") + bob.heldQuantity("TECH") + tech.getAvailableQuantity())
                .isEqualTo(tech.getTotalQuantity());
    }

    @Nested
    @DisplayName("Rights issue")
    class RightsIssue {

        private CorporateAction card;

        @BeforeEach
        void announce() {
            card = give(alice, "ca-rights", CorporateActionDetails.rightIssue(1, 2, new BigDecimal("0.5")));
            card.setStatus(RightIssueStatus.PENDING);
        }

        @Test
        void announcement_freezesEligibleHolders() {
            TradeResult result = executor.playCorporateAction(game, alice, play("ca-rights", "TECH", 0));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).startsWith("Rights issue announced for TechCorp");
            assertThat(card.getStatus()).isEqualTo(RightIssueStatus.ACTIVE);
            assertThat(card.getEligiblePlayerIds()).containsExactly("a", "b");
            assertThat(card.getExpiresAtPlayerId()).isEqualTo("a");
            assertThat(card.getPlayersProcessed()).isEmpty();
            assertThat(alice.getCash()).isEqualByComparingTo("1000.00");
        }

        @Test
        void announcementWithQuantity_buysOwnEntitlement() {
            TradeResult result = executor.playCorporateAction(game, alice, play("ca-rights", "TECH", 10));

            assertThat(result.getMessage()).isEqualTo("Purchased 10 TechCorp shares at $55.00 for $550.00");
            assertThat(alice.heldQuantity("TECH")).isEqualTo(110);
            assertThat(alice.getCash()).isEqualByComparingTo("450.00");
            assertThat(tech.getAvailableQuantity()).isEqualTo(200_000 - 160);
            assertThat(card.getPlayersProcessed()).containsExactly("a");
        }

        @Test
        void otherHolder_buysOnceAtDiscount() {
            executor.playCorporateAction(game, alice, play("ca-rights", "TECH", 0));

            TradeResult result = executor.purchaseRightIssue(game, bob, purchase(10));

            assertThat(result.isSuccess()).isTrue();
            assertThat(bob.heldQuantity("TECH")).isEqualTo(60);
            assertThat(bob.getCash()).isEqualByComparingTo("450.00");
            // (50 * 100 + 550) / 60
            assertThat(bob.findHolding("TECH").orElseThrow().getAverageCost()).isEqualByComparingTo("92.50");
            assertThat(executor.purchaseRightIssue(game, bob, purchase(1)).getMessage())
                    .isEqualTo("You have already participated in this rights issue");
        }

        @Test
        void purchaseAboveEntitlement_isRejected() {
            executor.playCorporateAction(game, alice, play("ca-rights", "TECH", 0));

            TradeResult result = executor.purchaseRightIssue(game, bob, purchase(26));

            assertThat(result.getMessage()).isEqualTo("Can only buy up to 25 TechCorp shares");
            assertThat(bob.heldQuantity("TECH")).isEqualTo(50);
        }

        @Test
        void nonHolder_isNotEligible() {
            executor.playCorporateAction(game, alice, play("ca-rights", "TECH", 0));

            assertThat(executor.purchaseRightIssue(game, cara, purchase(1)).getMessage())
                    .isEqualTo("You are not eligible for this rights issue");
        }

        @Test
        void insufficientFunds_isRejected() {
            executor.playCorporateAction(game, alice, play("ca-rights", "TECH", 0));
            bob.setCash(new BigDecimal("100.00"));

            assertThat(executor.purchaseRightIssue(game, bob, purchase(2)).getMessage()).isEqualTo("Insufficient funds");
        }

        @Test
        void expiredIssue_isRejected() {
            executor.playCorporateAction(game, alice, play("ca-rights", "TECH", 0));
            card.setStatus(RightIssueStatus.EXPIRED);

            assertThat(executor.purchaseRightIssue(game, bob, purchase(1)).getMessage())
                    .isEqualTo("Rights issue is no longer active");
        }

        @Test
        void unknownIssue_isRejected() {
            TradeResult result = executor.purchaseRightIssue(game, bob, TradeAction.builder()
                    .type(ActionType.PURCHASE_RIGHT_ISSUE)
                    .corporateActionId("missing")
                    .quantity(1)
                    .build());

            assertThat(result.getMessage()).isEqualTo("Rights issue not found");
        }

        private TradeAction purchase(int quantity) {
            return TradeAction.builder()
                    .type(ActionType.PURCHASE_RIGHT_ISSUE)
                    .corporateActionId("ca-rights")
                    .quantity(quantity)
                    .build();
        }
    }

    private static Player player(String id, String name, int techShares) {
        Player player = Player.builder().id(id).name(name).cash(new BigDecimal("1000.00")).build();
        if (techShares > 0) {
            player.getPortfolio().add(new StockHolding("TECH", techShares, new BigDecimal("100.00")));
        }
        return player;
    }

    private static CorporateAction give(Player owner, String id, CorporateActionDetails details) {
        CorporateAction card = CorporateAction.builder()
                .id(id)
                .type(details.getType())
                .title(details.getType() == CorporateActionType.DIVIDEND ? "Declare Dividend" : "Card")
                .details(details)
                .round(1)
                .playerId(owner.getId())
                .build();
        owner.getCorporateActions().add(card);
        return card;
    }

    private static TradeAction play(String corporateActionId, String symbol, Integer quantity) {
        return TradeAction.builder()
                .type(ActionType.PLAY_CORPORATE_ACTION)
                .corporateActionId(corporateActionId)
                .symbol(symbol)
                .quantity(quantity)
                .build();
    }
}
