package com.stockgame.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a new game. The upper bound on players is also checked against
 * {@code stockgame.game.max-players} by the service.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CreateGameRequest {

    @NotEmpty(message = "At least one player is required")
    @Size(max = 4, message = "At most 4 players can join a game")
    private List<@NotBlank(message = "Player name is required") String> playerNames;

    /** Defaults to {@code stockgame.game.max-rounds} when omitted. */
    @Min(value = 1, message = "maxRounds must be at least 1")
    @Max(value = 50, message = "maxRounds must be at most 50")
    private Integer maxRounds;
}
