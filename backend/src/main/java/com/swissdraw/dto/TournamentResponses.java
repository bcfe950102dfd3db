package com.swissdraw.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class TournamentResponses {

    private TournamentResponses() {
    }

    public record TournamentSummary(
            UUID tournamentId,
            String name,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record TournamentDetail(
            UUID tournamentId,
            String name,
            long playerCount,
            long matchCount,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record PlayerCount(
            UUID tournamentId,
            long count
    ) {
    }
}
