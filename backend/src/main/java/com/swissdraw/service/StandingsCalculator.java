package com.swissdraw.service;

import com.swissdraw.config.SwissRuntimeProperties;
import com.swissdraw.model.Match;
import com.swissdraw.model.Player;
import com.swissdraw.model.Tournament;
import com.swissdraw.repository.MatchRepository;
import com.swissdraw.repository.PlayerRepository;
import com.swissdraw.repository.TournamentRepository;
import com.swissdraw.web.SwissPairingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Scores, tie-breaks and result reporting for Swiss tournaments.
 *
 * <p>Points: win 1.0, draw 0.5, loss 0.0, bye 1.0. The opponent-win average ({@code opp_win}) of a
 * player is the mean of the current points of every opponent they have faced.
 */
@Service
@RequiredArgsConstructor
public class StandingsCalculator {

    private static final Logger log = LoggerFactory.getLogger(StandingsCalculator.class);

    static final double WIN_POINTS = 1.0;
    static final double DRAW_POINTS = 0.5;
    static final double LOSS_POINTS = 0.0;
    static final double BYE_POINTS = 1.0;

    /**
     * Standings order, also the input order for pairing.
     */
    static final Comparator<Player> STANDINGS_ORDER =
            Comparator.comparing(Player::getPoints, Comparator.reverseOrder())
                    .thenComparing(Player::getName)
                    .thenComparing(StandingsCalculator::playerIdKey);

    static final Comparator<Player> FINAL_RANKING_ORDER =
            Comparator.comparing(Player::getPoints, Comparator.reverseOrder())
                    .thenComparing(Player::getOppWin, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(Player::getName)
                    .thenComparing(StandingsCalculator::playerIdKey);

    private final TournamentRepository tournamentRepository;
    private final PlayerRepository playerRepository;
    private final MatchRepository matchRepository;
    private final SwissRuntimeProperties swissRuntimeProperties;

    @Transactional(readOnly = true)
    public List<Player> rank(UUID tournamentId) {
        requireTournament(tournamentId);
        List<Player> players = new ArrayList<>(playerRepository.findByTournamentId(tournamentId));
        players.sort(STANDINGS_ORDER);
        return players;
    }

    @Transactional
    public Player recomputeOppWin(UUID playerId) {
        UUID tournamentId = requireTournamentIdOf(playerId);
        lockTournament(tournamentId);
        Player player = requirePlayerInTournament(tournamentId, playerId);
        applyOppWin(player);
        return playerRepository.save(player);
    }

    @Transactional
    public Match reportMatch(UUID player1Id, UUID player2Id, boolean draw) {
        requireDistinctPlayers(player1Id, player2Id);
        UUID tournamentId = requireTournamentIdOf(player1Id);
        if (!tournamentId.equals(requireTournamentIdOf(player2Id))) {
            throw SwissPairingException.invalidMatch(
                    "Players " + player1Id + " and " + player2Id + " belong to different tournaments"
            );
        }
        return reportMatch(tournamentId, player1Id, player2Id, draw);
    }

    /**
     * Same as {@link #reportMatch(UUID, UUID, boolean)}, but both players must be registered in
     * the given tournament.
     */
    @Transactional
    public Match reportMatch(UUID tournamentId, UUID player1Id, UUID player2Id, boolean draw) {
        requireDistinctPlayers(player1Id, player2Id);
        // players are read only once the tournament row is locked
        lockTournament(tournamentId);
        return recordMatch(
                tournamentId,
                requirePlayerInTournament(tournamentId, player1Id),
                requirePlayerInTournament(tournamentId, player2Id),
                draw
        );
    }

    private Match recordMatch(UUID tournamentId, Player player1, Player player2, boolean draw) {
        UUID player1Id = player1.getPlayerId();
        UUID player2Id = player2.getPlayerId();
        if (player1.hasPlayed(player2Id) || player2.hasPlayed(player1Id)
                || matchRepository.existsBetween(player1Id, player2Id)) {
            log.warn("Rejected rematch between {} and {} in tournament {}", player1Id, player2Id, tournamentId);
            throw SwissPairingException.rematch(
                    "Players " + player1Id + " and " + player2Id + " have already played each other"
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        Match match = new Match();
        match.setMatchId(UUID.randomUUID());
        match.setTournamentId(tournamentId);
        match.setPlayer1Id(player1Id);
        match.setPlayer2Id(player2Id);
        match.setDraw(draw);
        match.setCreatedAt(now);
        Match savedMatch = matchRepository.save(match);

        recordResult(player1, player2Id, draw ? DRAW_POINTS : WIN_POINTS, now);
        recordResult(player2, player1Id, draw ? DRAW_POINTS : LOSS_POINTS, now);

        applyOppWin(player1);
        applyOppWin(player2);
        playerRepository.save(player1);
        playerRepository.save(player2);
        refreshDependentTieBreaks(List.of(player1Id, player2Id), now);

        log.info(
                "Recorded {} in tournament {}: {} ({}) vs {} ({})",
                draw ? "draw" : "win",
                tournamentId,
                player1.getName(),
                player1.getPoints(),
                player2.getName(),
                player2.getPoints()
        );
        return savedMatch;
    }

    /**
     * Awards a bye: a win without an opponent. The bye counts towards matches played but never
     * becomes a rematch constraint.
     */
    @Transactional
    public Player assignBye(UUID playerId) {
        return assignBye(requireTournamentIdOf(playerId), playerId);
    }

    @Transactional
    public Player assignBye(UUID tournamentId, UUID playerId) {
        lockTournament(tournamentId);
        return awardBye(requirePlayerInTournament(tournamentId, playerId));
    }

    private Player awardBye(Player player) {
        UUID playerId = player.getPlayerId();
        if (Boolean.TRUE.equals(player.getHadBye())) {
            throw SwissPairingException.byeAlreadyAwarded(
                    "Player " + playerId + " (" + player.getName() + ") has already received a bye"
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        player.setPoints(player.getPoints() + BYE_POINTS);
        player.setMatchesPlayed(player.getMatchesPlayed() + 1);
        player.setHadBye(true);
        player.setUpdatedAt(now);
        Player savedPlayer = playerRepository.save(player);
        refreshDependentTieBreaks(List.of(playerId), now);

        log.info("Awarded bye to {} ({}) in tournament {}", player.getName(), playerId, player.getTournamentId());
        return savedPlayer;
    }

    @Transactional(readOnly = true)
    public List<FinalRanking> finalRankings(UUID tournamentId) {
        requireTournament(tournamentId);
        List<Player> players = new ArrayList<>(playerRepository.findByTournamentId(tournamentId));
        players.sort(FINAL_RANKING_ORDER);
        return toFinalRankings(players);
    }

    /**
     * Recomputes opp_win for the whole field and returns the resulting final rankings.
     */
    @Transactional
    public List<FinalRanking> refreshTieBreaks(UUID tournamentId) {
        lockTournament(tournamentId);
        List<Player> players = new ArrayList<>(playerRepository.findByTournamentId(tournamentId));
        Map<UUID, Double> pointsById = new LinkedHashMap<>();
        for (Player player : players) {
            pointsById.put(player.getPlayerId(), player.getPoints());
        }

        OffsetDateTime now = OffsetDateTime.now();
        for (Player player : players) {
            player.setOppWin(averagePoints(player, pointsById));
            player.setUpdatedAt(now);
        }
        playerRepository.saveAll(players);
        log.info("Refreshed tie-breaks for {} players in tournament {}", players.size(), tournamentId);

        players.sort(FINAL_RANKING_ORDER);
        return toFinalRankings(players);
    }

    private void recordResult(Player player, UUID opponentId, double awardedPoints, OffsetDateTime now) {
        player.setPoints(player.getPoints() + awardedPoints);
        player.setMatchesPlayed(player.getMatchesPlayed() + 1);
        player.getPrevOpponents().add(opponentId);
        player.setUpdatedAt(now);
    }

    private void refreshDependentTieBreaks(List<UUID> changedPlayerIds, OffsetDateTime now) {
        if (!swissRuntimeProperties.getStandings().isCascadeOppWinRefresh()) {
            return;
        }

        Map<UUID, Player> dependents = new LinkedHashMap<>();
        for (UUID changedPlayerId : changedPlayerIds) {
            for (Player dependent : playerRepository.findByPrevOpponent(changedPlayerId)) {
                if (!changedPlayerIds.contains(dependent.getPlayerId())) {
                    dependents.putIfAbsent(dependent.getPlayerId(), dependent);
                }
            }
        }
        for (Player dependent : dependents.values()) {
            applyOppWin(dependent);
            dependent.setUpdatedAt(now);
        }
        if (!dependents.isEmpty()) {
            playerRepository.saveAll(dependents.values());
        }
    }

    private void applyOppWin(Player player) {
        if (player.getPrevOpponents().isEmpty()) {
            player.setOppWin(null);
            return;
        }

        Map<UUID, Double> pointsById = new LinkedHashMap<>();
        for (Player opponent : playerRepository.findAllById(player.getPrevOpponents())) {
            pointsById.put(opponent.getPlayerId(), opponent.getPoints());
        }
        player.setOppWin(averagePoints(player, pointsById));
    }

    private static Double averagePoints(Player player, Map<UUID, Double> pointsById) {
        if (player.getPrevOpponents().isEmpty()) {
            return null;
        }

        double total = 0.0;
        for (UUID opponentId : player.getPrevOpponents()) {
            Double opponentPoints = pointsById.get(opponentId);
            if (opponentPoints == null) {
                throw new IllegalStateException(
                        "Opponent " + opponentId + " of player " + player.getPlayerId() + " no longer exists"
                );
            }
            total += opponentPoints;
        }
        return total / player.getPrevOpponents().size();
    }

    // competition ranking: players level on points and opp_win share a position
    private static List<FinalRanking> toFinalRankings(List<Player> orderedPlayers) {
        List<FinalRanking> rankings = new ArrayList<>(orderedPlayers.size());
        int position = 0;
        Player previous = null;
        for (int i = 0; i < orderedPlayers.size(); i++) {
            Player player = orderedPlayers.get(i);
            if (previous == null
                    || !previous.getPoints().equals(player.getPoints())
                    || !Objects.equals(previous.getOppWin(), player.getOppWin())) {
                position = i + 1;
            }
            rankings.add(new FinalRanking(
                    position,
                    player.getPlayerId(),
                    player.getName(),
                    player.getPoints(),
                    player.getMatchesPlayed(),
                    player.getOppWin()
            ));
            previous = player;
        }
        return rankings;
    }

    // lowercase hex compares like the database uuid type, UUID.compareTo does not
    private static String playerIdKey(Player player) {
        return player.getPlayerId().toString();
    }

    private void requireTournament(UUID tournamentId) {
        if (!tournamentRepository.existsById(tournamentId)) {
            throw tournamentNotFound(tournamentId);
        }
    }

    private Tournament lockTournament(UUID tournamentId) {
        return tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> tournamentNotFound(tournamentId));
    }

    private Player requirePlayer(UUID playerId) {
        return playerRepository.findById(playerId)
                .orElseThrow(() -> playerNotFound(playerId));
    }

    private UUID requireTournamentIdOf(UUID playerId) {
        return playerRepository.findTournamentIdByPlayerId(playerId)
                .orElseThrow(() -> playerNotFound(playerId));
    }

    private Player requirePlayerInTournament(UUID tournamentId, UUID playerId) {
        Player player = requirePlayer(playerId);
        if (!player.getTournamentId().equals(tournamentId)) {
            throw new ResponseStatusException(
                    HttpStatus.NOT_FOUND,
                    "Player " + playerId + " is not registered in tournament " + tournamentId
            );
        }
        return player;
    }

    private static void requireDistinctPlayers(UUID player1Id, UUID player2Id) {
        if (Objects.equals(player1Id, player2Id)) {
            throw SwissPairingException.invalidMatch("A player cannot be matched against themselves: " + player1Id);
        }
    }

    private static ResponseStatusException playerNotFound(UUID playerId) {
        return new ResponseStatusException(
                HttpStatus.NOT_FOUND,
                "Player not found: " + playerId
        );
    }

    private static ResponseStatusException tournamentNotFound(UUID tournamentId) {
        return new ResponseStatusException(
                HttpStatus.NOT_FOUND,
                "Tournament not found: " + tournamentId
        );
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
