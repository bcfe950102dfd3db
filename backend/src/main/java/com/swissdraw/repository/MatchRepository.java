package com.swissdraw.repository;

import com.swissdraw.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MatchRepository extends JpaRepository<Match, UUID> {
    List<Match> findByTournamentIdOrderByCreatedAtAsc(UUID tournamentId);

    long countByTournamentId(UUID tournamentId);

    @Query("""
            select case when count(m) > 0 then true else false end from Match m
            where (m.player1Id = :firstPlayerId and m.player2Id = :secondPlayerId)
               or (m.player1Id = :secondPlayerId and m.player2Id = :firstPlayerId)
            """)
    boolean existsBetween(
            @Param("firstPlayerId") UUID firstPlayerId,
            @Param("secondPlayerId") UUID secondPlayerId
    );
}
