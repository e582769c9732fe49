package com.stockgame.domain.model;

import com.stockgame.domain.enums.CorporateActionType;
import com.stockgame.domain.enums.RightIssueStatus;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A corporate-action card. The target {@code symbol} is chosen by the player when the card is
 * played, not when it is dealt.
 *
 * <p>Rights issues carry extra lifecycle state: the eligible holders are frozen at play time and
 * the issue stays open until {@code expiresAtPlayerId} (the player who played it) is about to
 * move again, or until the round ends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorporateAction {

    private String id;
    private CorporateActionType type;
    private String symbol;
    private String title;
    private String description;
    private CorporateActionDetails details;
    private int round;
    private String playerId;

    /** Players who have already taken part; only grows. */
    @Builder.Default
    private List<String> playersProcessed = new ArrayList<>();

    private boolean played;

    private RightIssueStatus status;
    private String expiresAtPlayerId;

    @Builder.Default
    private List<String> eligiblePlayerIds = new ArrayList<>();
}
