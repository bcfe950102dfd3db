package com.swissdraw.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class MatchResponses {

    private MatchResponses() {
    }

    public record MatchSummary(
            UUID matchId,
            UUID tournamentId,
            UUID player1Id,
            UUID player2Id,
            boolean draw,
            UUID winnerPlayerId,
            OffsetDateTime createdAt
    ) {
    }

    public record Pairing(
            int table,
            UUID player1Id,
            String player1Name,
            UUID player2Id,
            String player2Name
    ) {
    }

    public record Bye(
            UUID playerId,
            String name
    ) {
    }

    public record RoundPairing(
            UUID tournamentId,
            List<Pairing> pairings,
            Bye bye
    ) {
    }
}
