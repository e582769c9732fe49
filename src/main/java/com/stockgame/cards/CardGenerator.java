package com.stockgame.cards;

import java.util.List;

/**
 * Source of the cards dealt at the start of each round.
 *
 * <p>Returns exactly {@code playerCount} hands. Owner and round on the returned cards are
 * filled in by the engine.
 */
public interface CardGenerator {

    List<CardHand> dealHands(int round, int playerCount);
}
