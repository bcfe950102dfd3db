package com.swissdraw.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public final class TournamentRequests {

    private TournamentRequests() {
    }

    public record CreateTournamentRequest(
            @NotBlank(message = "name is required")
            @Size(max = 200, message = "name must be at most 200 characters")
            String name
    ) {
    }

    public record RenameTournamentRequest(
            @NotBlank(message = "name is required")
            @Size(max = 200, message = "name must be at most 200 characters")
            String name
    ) {
    }

    public record RegisterPlayerRequest(
            @NotBlank(message = "name is required")
            @Size(max = 100, message = "name must be at most 100 characters")
            String name
    ) {
    }

    /**
     * player1 is the winner unless {@code draw} is true.
     */
    public record ReportMatchRequest(
            @NotNull(message = "player1Id is required")
            UUID player1Id,

            @NotNull(message = "player2Id is required")
            UUID player2Id,

            boolean draw
    ) {
    }

    public record AssignByeRequest(
            @NotNull(message = "playerId is required")
            UUID playerId
    ) {
    }
}
