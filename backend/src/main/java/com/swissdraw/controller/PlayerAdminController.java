package com.swissdraw.controller;

import com.swissdraw.service.TournamentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reset utility that clears every player of every tournament.
 */
@RestController
@RequestMapping("/api/players")
public class PlayerAdminController {

    private final TournamentService tournamentService;

    public PlayerAdminController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteAllPlayers() {
        tournamentService.deleteAllPlayers();
        return ResponseEntity.noContent().build();
    }
}
