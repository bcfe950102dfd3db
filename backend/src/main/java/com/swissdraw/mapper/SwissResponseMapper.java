package com.swissdraw.mapper;

import com.swissdraw.dto.MatchResponses;
import com.swissdraw.dto.PlayerResponses;
import com.swissdraw.dto.TournamentResponses;
import com.swissdraw.model.Match;
import com.swissdraw.model.Player;
import com.swissdraw.model.Tournament;
import com.swissdraw.repository.PlayerStandingRow;
import com.swissdraw.service.StandingsCalculator;
import com.swissdraw.service.SwissPairingPlanner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Component
public class SwissResponseMapper {

    public TournamentResponses.TournamentSummary toTournamentSummaryResponse(Tournament tournament) {
        return new TournamentResponses.TournamentSummary(
                tournament.getTournamentId(),
                tournament.getTournamentName(),
                tournament.getCreatedAt(),
                tournament.getUpdatedAt()
        );
    }

    public List<TournamentResponses.TournamentSummary> toTournamentSummaryResponses(Collection<Tournament> tournaments) {
        return tournaments.stream()
                .map(this::toTournamentSummaryResponse)
                .toList();
    }

    public TournamentResponses.TournamentDetail toTournamentDetailResponse(
            Tournament tournament,
            long playerCount,
            long matchCount
    ) {
        return new TournamentResponses.TournamentDetail(
                tournament.getTournamentId(),
                tournament.getTournamentName(),
                playerCount,
                matchCount,
                tournament.getCreatedAt(),
                tournament.getUpdatedAt()
        );
    }

    public PlayerResponses.PlayerStanding toPlayerStandingResponse(Player player) {
        return new PlayerResponses.PlayerStanding(
                player.getPlayerId(),
                player.getTournamentId(),
                player.getName(),
                player.getPoints(),
                player.getMatchesPlayed(),
                Boolean.TRUE.equals(player.getHadBye()),
                player.getOppWin(),
                Set.copyOf(player.getPrevOpponents()),
                player.getUpdatedAt()
        );
    }

    public List<PlayerResponses.PlayerStanding> toPlayerStandingResponses(Collection<Player> players) {
        return players.stream()
                .map(this::toPlayerStandingResponse)
                .toList();
    }

    public List<PlayerResponses.StandingsViewRow> toStandingsViewResponses(Collection<PlayerStandingRow> rows) {
        return rows.stream()
                .map(row -> new PlayerResponses.StandingsViewRow(
                        row.getPlayerId(),
                        row.getName(),
                        row.getPoints(),
                        row.getMatchesPlayed()
                ))
                .toList();
    }

    public List<PlayerResponses.FinalRanking> toFinalRankingResponses(
            Collection<StandingsCalculator.FinalRanking> rankings
    ) {
        return rankings.stream()
                .map(ranking -> new PlayerResponses.FinalRanking(
                        ranking.rank(),
                        ranking.playerId(),
                        ranking.name(),
                        ranking.points(),
                        ranking.matchesPlayed(),
                        ranking.oppWin()
                ))
                .toList();
    }

    public MatchResponses.MatchSummary toMatchSummaryResponse(Match match) {
        boolean draw = Boolean.TRUE.equals(match.getDraw());
        return new MatchResponses.MatchSummary(
                match.getMatchId(),
                match.getTournamentId(),
                match.getPlayer1Id(),
                match.getPlayer2Id(),
                draw,
                draw ? null : match.getPlayer1Id(),
                match.getCreatedAt()
        );
    }

    public List<MatchResponses.MatchSummary> toMatchSummaryResponses(Collection<Match> matches) {
        return matches.stream()
                .map(this::toMatchSummaryResponse)
                .toList();
    }

    public MatchResponses.RoundPairing toRoundPairingResponse(UUID tournamentId, SwissPairingPlanner.PairingPlan plan) {
        List<MatchResponses.Pairing> pairings = new ArrayList<>(plan.pairings().size());
        int table = 1;
        for (SwissPairingPlanner.PlannedPairing pairing : plan.pairings()) {
            pairings.add(new MatchResponses.Pairing(
                    table++,
                    pairing.player1().getPlayerId(),
                    pairing.player1().getName(),
                    pairing.player2().getPlayerId(),
                    pairing.player2().getName()
            ));
        }

        MatchResponses.Bye bye = plan.hasBye()
                ? new MatchResponses.Bye(plan.byePlayer().getPlayerId(), plan.byePlayer().getName())
                : null;
        return new MatchResponses.RoundPairing(tournamentId, List.copyOf(pairings), bye);
    }
}
