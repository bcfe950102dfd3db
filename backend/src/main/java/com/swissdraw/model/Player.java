package com.swissdraw.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "players")
public class Player {

    @Id
    @Column(name = "player_id", nullable = false, updatable = false)
    private UUID playerId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "points", nullable = false)
    private Double points = 0.0;

    @Column(name = "matches_played", nullable = false)
    private Integer matchesPlayed = 0;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "player_opponents", joinColumns = @JoinColumn(name = "player_id"))
    @Column(name = "opponent_id", nullable = false)
    private Set<UUID> prevOpponents = new HashSet<>();

    @Column(name = "bye", nullable = false)
    private Boolean hadBye = false;

    /**
     * Mean current points of every opponent in {@link #prevOpponents}; null until the first match.
     */
    @Column(name = "opp_win")
    private Double oppWin;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean hasPlayed(UUID opponentId) {
        return prevOpponents.contains(opponentId);
    }
}
