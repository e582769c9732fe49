package com.stockgame.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ExcludeEventRequest {

    @NotBlank(message = "Event id is required")
    private String eventId;

    @NotBlank(message = "Leader id is required")
    private String leaderId;
}
