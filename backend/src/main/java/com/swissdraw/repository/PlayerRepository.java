package com.swissdraw.repository;

import com.swissdraw.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlayerRepository extends JpaRepository<Player, UUID> {
    List<Player> findByTournamentId(UUID tournamentId);

    long countByTournamentId(UUID tournamentId);

    @Query("select p.tournamentId from Player p where p.playerId = :playerId")
    Optional<UUID> findTournamentIdByPlayerId(@Param("playerId") UUID playerId);

    @Query("select p from Player p where :opponentId member of p.prevOpponents")
    List<Player> findByPrevOpponent(@Param("opponentId") UUID opponentId);

    @Query(value = """
            SELECT
                standing.player_id AS playerId,
                standing.name AS name,
                standing.points AS points,
                standing.matches_played AS matchesPlayed
            FROM tournament_standings standing
            WHERE standing.tournament_id = :tournamentId
            ORDER BY standing.points DESC, standing.name COLLATE "C", standing.player_id
            """, nativeQuery = true)
    List<PlayerStandingRow> findStandingRows(@Param("tournamentId") UUID tournamentId);

    // player_opponents and matches rows go with the players through ON DELETE CASCADE
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Player p where p.tournamentId = :tournamentId")
    int deleteByTournamentIdInBulk(@Param("tournamentId") UUID tournamentId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Player p")
    int deleteAllInBulk();
}
