package com.swissdraw.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A reported result. Unless {@code draw} is set, player1 won and player2 lost.
 */
@Getter
@Setter
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private UUID matchId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "player1_id", nullable = false, updatable = false)
    private UUID player1Id;

    @Column(name = "player2_id", nullable = false, updatable = false)
    private UUID player2Id;

    @Column(name = "draw", nullable = false, updatable = false)
    private Boolean draw = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
