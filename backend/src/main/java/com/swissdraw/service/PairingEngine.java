package com.swissdraw.service;

import com.swissdraw.config.SwissRuntimeProperties;
import com.swissdraw.model.Player;
import com.swissdraw.web.SwissPairingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Suggests the next round of a tournament. Nothing is written: the caller awards the bye through
 * {@link StandingsCalculator#assignBye(UUID)} and reports each pairing once its result is known.
 */
@Service
@RequiredArgsConstructor
public class PairingEngine {

    private static final Logger log = LoggerFactory.getLogger(PairingEngine.class);

    private final StandingsCalculator standingsCalculator;
    private final SwissPairingPlanner swissPairingPlanner;
    private final SwissRuntimeProperties swissRuntimeProperties;

    @Transactional(readOnly = true)
    public SwissPairingPlanner.PairingPlan nextRoundPairings(UUID tournamentId) {
        List<Player> ranked = standingsCalculator.rank(tournamentId);
        boolean backtrackingFallback = swissRuntimeProperties.getPairing().isBacktrackingFallback();

        SwissPairingPlanner.PairingPlan plan;
        try {
            plan = swissPairingPlanner.plan(ranked, backtrackingFallback);
        } catch (SwissPairingException ex) {
            log.warn("Pairing failed for tournament {} with {} players: {}", tournamentId, ranked.size(), ex.getMessage());
            throw ex;
        }

        log.info(
                "Paired tournament {}: {} pairings, bye={}",
                tournamentId,
                plan.pairings().size(),
                plan.hasBye() ? plan.byePlayer().getPlayerId() : "none"
        );
        return plan;
    }
}
