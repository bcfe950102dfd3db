package com.swissdraw.service;

import com.swissdraw.dto.MatchResponses;
import com.swissdraw.dto.PlayerResponses;
import com.swissdraw.dto.TournamentRequests;
import com.swissdraw.dto.TournamentResponses;
import com.swissdraw.mapper.SwissResponseMapper;
import com.swissdraw.model.Player;
import com.swissdraw.model.Tournament;
import com.swissdraw.repository.MatchRepository;
import com.swissdraw.repository.PlayerRepository;
import com.swissdraw.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Tournament and player bookkeeping around the pairing engine.
 */
@Service
@RequiredArgsConstructor
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);

    private final TournamentRepository tournamentRepository;
    private final PlayerRepository playerRepository;
    private final MatchRepository matchRepository;
    private final SwissResponseMapper swissResponseMapper;

    @Transactional
    public TournamentResponses.TournamentDetail createTournament(TournamentRequests.CreateTournamentRequest request) {
        OffsetDateTime now = OffsetDateTime.now();

        Tournament tournament = new Tournament();
        tournament.setTournamentId(UUID.randomUUID());
        tournament.setTournamentName(request.name().trim());
        tournament.setCreatedAt(now);
        tournament.setUpdatedAt(now);

        Tournament savedTournament = tournamentRepository.save(tournament);
        log.info("Created tournament {} ({})", savedTournament.getTournamentName(), savedTournament.getTournamentId());
        return swissResponseMapper.toTournamentDetailResponse(savedTournament, 0, 0);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.TournamentSummary> listTournaments() {
        return swissResponseMapper.toTournamentSummaryResponses(tournamentRepository.findAllByOrderByCreatedAtAsc());
    }

    @Transactional(readOnly = true)
    public TournamentResponses.TournamentDetail getTournament(UUID tournamentId) {
        Tournament tournament = requireTournament(tournamentId);
        return swissResponseMapper.toTournamentDetailResponse(
                tournament,
                playerRepository.countByTournamentId(tournamentId),
                matchRepository.countByTournamentId(tournamentId)
        );
    }

    @Transactional
    public TournamentResponses.TournamentDetail renameTournament(
            UUID tournamentId,
            TournamentRequests.RenameTournamentRequest request
    ) {
        Tournament tournament = requireTournament(tournamentId);
        tournament.setTournamentName(request.name().trim());
        tournament.setUpdatedAt(OffsetDateTime.now());
        Tournament savedTournament = tournamentRepository.save(tournament);
        return swissResponseMapper.toTournamentDetailResponse(
                savedTournament,
                playerRepository.countByTournamentId(tournamentId),
                matchRepository.countByTournamentId(tournamentId)
        );
    }

    /**
     * Players, their opponent history and matches are removed by the schema's ON DELETE CASCADE.
     */
    @Transactional
    public void deleteTournament(UUID tournamentId) {
        Tournament tournament = requireTournament(tournamentId);
        tournamentRepository.delete(tournament);
        log.info("Deleted tournament {}", tournamentId);
    }

    @Transactional
    public PlayerResponses.PlayerStanding registerPlayer(
            UUID tournamentId,
            TournamentRequests.RegisterPlayerRequest request
    ) {
        requireTournament(tournamentId);
        OffsetDateTime now = OffsetDateTime.now();

        Player player = new Player();
        player.setPlayerId(UUID.randomUUID());
        player.setTournamentId(tournamentId);
        player.setName(request.name().trim());
        player.setCreatedAt(now);
        player.setUpdatedAt(now);

        Player savedPlayer = playerRepository.save(player);
        log.info("Registered player {} ({}) in tournament {}", savedPlayer.getName(), savedPlayer.getPlayerId(), tournamentId);
        return swissResponseMapper.toPlayerStandingResponse(savedPlayer);
    }

    @Transactional(readOnly = true)
    public TournamentResponses.PlayerCount countPlayers(UUID tournamentId) {
        requireTournament(tournamentId);
        return new TournamentResponses.PlayerCount(tournamentId, playerRepository.countByTournamentId(tournamentId));
    }

    @Transactional
    public int deletePlayers(UUID tournamentId) {
        requireTournament(tournamentId);
        int deleted = playerRepository.deleteByTournamentIdInBulk(tournamentId);
        log.info("Deleted {} players from tournament {}", deleted, tournamentId);
        return deleted;
    }

    @Transactional
    public int deleteAllPlayers() {
        int deleted = playerRepository.deleteAllInBulk();
        log.info("Deleted all {} players", deleted);
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<MatchResponses.MatchSummary> listMatches(UUID tournamentId) {
        requireTournament(tournamentId);
        return swissResponseMapper.toMatchSummaryResponses(matchRepository.findByTournamentIdOrderByCreatedAtAsc(tournamentId));
    }

    @Transactional(readOnly = true)
    public List<PlayerResponses.StandingsViewRow> standingsView(UUID tournamentId) {
        requireTournament(tournamentId);
        return swissResponseMapper.toStandingsViewResponses(playerRepository.findStandingRows(tournamentId));
    }

    private Tournament requireTournament(UUID tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + tournamentId
                ));
    }
}
