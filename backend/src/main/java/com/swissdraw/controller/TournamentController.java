package com.swissdraw.controller;

import com.swissdraw.dto.PlayerResponses;
import com.swissdraw.dto.TournamentRequests;
import com.swissdraw.dto.TournamentResponses;
import com.swissdraw.service.TournamentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentService tournamentService;

    public TournamentController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    @PostMapping
    public ResponseEntity<TournamentResponses.TournamentDetail> createTournament(
            @Valid @RequestBody TournamentRequests.CreateTournamentRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tournamentService.createTournament(request));
    }

    @GetMapping
    public ResponseEntity<List<TournamentResponses.TournamentSummary>> listTournaments() {
        return ResponseEntity.ok(tournamentService.listTournaments());
    }

    @GetMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentDetail> getTournament(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.getTournament(tournamentId));
    }

    @PatchMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentDetail> renameTournament(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody TournamentRequests.RenameTournamentRequest request
    ) {
        return ResponseEntity.ok(tournamentService.renameTournament(tournamentId, request));
    }

    @DeleteMapping("/{tournamentId}")
    public ResponseEntity<Void> deleteTournament(@PathVariable UUID tournamentId) {
        tournamentService.deleteTournament(tournamentId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{tournamentId}/players")
    public ResponseEntity<PlayerResponses.PlayerStanding> registerPlayer(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody TournamentRequests.RegisterPlayerRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tournamentService.registerPlayer(tournamentId, request));
    }

    @GetMapping("/{tournamentId}/players/count")
    public ResponseEntity<TournamentResponses.PlayerCount> countPlayers(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.countPlayers(tournamentId));
    }

    @DeleteMapping("/{tournamentId}/players")
    public ResponseEntity<Void> deletePlayers(@PathVariable UUID tournamentId) {
        tournamentService.deletePlayers(tournamentId);
        return ResponseEntity.noContent().build();
    }
}
