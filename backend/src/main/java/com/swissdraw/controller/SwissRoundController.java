package com.swissdraw.controller;

import com.swissdraw.dto.MatchResponses;
import com.swissdraw.dto.PlayerResponses;
import com.swissdraw.dto.TournamentRequests;
import com.swissdraw.mapper.SwissResponseMapper;
import com.swissdraw.model.Match;
import com.swissdraw.model.Player;
import com.swissdraw.service.PairingEngine;
import com.swissdraw.service.StandingsCalculator;
import com.swissdraw.service.TournamentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tournaments/{tournamentId}")
public class SwissRoundController {

    private final StandingsCalculator standingsCalculator;
    private final PairingEngine pairingEngine;
    private final TournamentService tournamentService;
    private final SwissResponseMapper swissResponseMapper;

    public SwissRoundController(
            StandingsCalculator standingsCalculator,
            PairingEngine pairingEngine,
            TournamentService tournamentService,
            SwissResponseMapper swissResponseMapper
    ) {
        this.standingsCalculator = standingsCalculator;
        this.pairingEngine = pairingEngine;
        this.tournamentService = tournamentService;
        this.swissResponseMapper = swissResponseMapper;
    }

    @GetMapping("/standings")
    public ResponseEntity<List<PlayerResponses.PlayerStanding>> standings(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(swissResponseMapper.toPlayerStandingResponses(standingsCalculator.rank(tournamentId)));
    }

    @GetMapping("/standings/view")
    public ResponseEntity<List<PlayerResponses.StandingsViewRow>> standingsView(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.standingsView(tournamentId));
    }

    @GetMapping("/rankings")
    public ResponseEntity<List<PlayerResponses.FinalRanking>> finalRankings(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(swissResponseMapper.toFinalRankingResponses(standingsCalculator.finalRankings(tournamentId)));
    }

    @PostMapping("/tiebreaks/refresh")
    public ResponseEntity<List<PlayerResponses.FinalRanking>> refreshTieBreaks(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(swissResponseMapper.toFinalRankingResponses(standingsCalculator.refreshTieBreaks(tournamentId)));
    }

    @GetMapping("/pairings")
    public ResponseEntity<MatchResponses.RoundPairing> nextRoundPairings(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(swissResponseMapper.toRoundPairingResponse(
                tournamentId,
                pairingEngine.nextRoundPairings(tournamentId)
        ));
    }

    @GetMapping("/matches")
    public ResponseEntity<List<MatchResponses.MatchSummary>> listMatches(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.listMatches(tournamentId));
    }

    @PostMapping("/matches")
    public ResponseEntity<MatchResponses.MatchSummary> reportMatch(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody TournamentRequests.ReportMatchRequest request
    ) {
        Match match = standingsCalculator.reportMatch(
                tournamentId,
                request.player1Id(),
                request.player2Id(),
                request.draw()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(swissResponseMapper.toMatchSummaryResponse(match));
    }

    @PostMapping("/byes")
    public ResponseEntity<PlayerResponses.PlayerStanding> assignBye(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody TournamentRequests.AssignByeRequest request
    ) {
        Player player = standingsCalculator.assignBye(tournamentId, request.playerId());
        return ResponseEntity.ok(swissResponseMapper.toPlayerStandingResponse(player));
    }
}
