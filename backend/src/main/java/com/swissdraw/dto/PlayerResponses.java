package com.swissdraw.dto;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

public final class PlayerResponses {

    private PlayerResponses() {
    }

    public record PlayerStanding(
            UUID playerId,
            UUID tournamentId,
            String name,
            double points,
            int matchesPlayed,
            boolean hadBye,
            Double oppWin,
            Set<UUID> prevOpponents,
            OffsetDateTime updatedAt
    ) {
    }

    public record StandingsViewRow(
            UUID playerId,
            String name,
            double points,
            int matchesPlayed
    ) {
    }

    public record FinalRanking(
            int rank,
            UUID playerId,
            String name,
            double points,
            int matchesPlayed,
            Double oppWin
    ) {
    }
}
