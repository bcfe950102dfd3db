package com.swissdraw.service;

import com.swissdraw.model.Player;
import com.swissdraw.web.SwissPairingException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Swiss sequential pairing over an already ranked field.
 *
 * <p>An odd field first gives the bye to the lowest ranked player who has not had one. The
 * remaining players are then paired top-down: each unpaired player meets the highest ranked
 * remaining player they have not faced yet. The planner never touches the store.
 */
@Component
public class SwissPairingPlanner {

    static final int MAX_BACKTRACK_STEPS = 50_000;

    public PairingPlan plan(List<Player> rankedPlayers, boolean backtrackingFallback) {
        if (rankedPlayers == null) {
            throw new IllegalArgumentException("Ranked players are required");
        }
        validatePlayers(rankedPlayers);

        if (rankedPlayers.size() % 2 == 0) {
            return planWithoutBye(rankedPlayers, backtrackingFallback);
        }

        List<Player> byeCandidates = resolveByeCandidates(rankedPlayers);
        if (byeCandidates.isEmpty()) {
            throw SwissPairingException.noEligiblePlayerForBye(
                    "Every one of the " + rankedPlayers.size() + " players has already received a bye"
            );
        }

        Player byePlayer = byeCandidates.get(0);
        ScanResult scan = forwardScan(without(rankedPlayers, byePlayer));
        if (scan.isComplete()) {
            return new PairingPlan(scan.pairings(), byePlayer);
        }
        if (!backtrackingFallback) {
            throw stuck(scan.stuckPlayer());
        }

        BacktrackSearch search = new BacktrackSearch(rankedPlayers.size());
        for (Player candidate : byeCandidates) {
            List<PlannedPairing> pairings = search.run(without(rankedPlayers, candidate));
            if (pairings != null) {
                return new PairingPlan(List.copyOf(pairings), candidate);
            }
        }
        throw exhausted(rankedPlayers.size());
    }

    private static PairingPlan planWithoutBye(List<Player> rankedPlayers, boolean backtrackingFallback) {
        ScanResult scan = forwardScan(rankedPlayers);
        if (scan.isComplete()) {
            return new PairingPlan(scan.pairings(), null);
        }
        if (!backtrackingFallback) {
            throw stuck(scan.stuckPlayer());
        }

        List<PlannedPairing> pairings = new BacktrackSearch(rankedPlayers.size()).run(rankedPlayers);
        if (pairings == null) {
            throw exhausted(rankedPlayers.size());
        }
        return new PairingPlan(List.copyOf(pairings), null);
    }

    // bottom of the standings first
    private static List<Player> resolveByeCandidates(List<Player> rankedPlayers) {
        List<Player> candidates = new ArrayList<>();
        for (int i = rankedPlayers.size() - 1; i >= 0; i--) {
            Player player = rankedPlayers.get(i);
            if (!Boolean.TRUE.equals(player.getHadBye())) {
                candidates.add(player);
            }
        }
        return candidates;
    }

    private static ScanResult forwardScan(List<Player> pool) {
        List<Player> remaining = new ArrayList<>(pool);
        List<PlannedPairing> pairings = new ArrayList<>(pool.size() / 2);

        while (remaining.size() > 1) {
            Player top = remaining.get(0);
            int opponentIndex = -1;
            for (int i = 1; i < remaining.size(); i++) {
                if (!haveMet(top, remaining.get(i))) {
                    opponentIndex = i;
                    break;
                }
            }
            if (opponentIndex < 0) {
                return new ScanResult(List.copyOf(pairings), top);
            }

            pairings.add(new PlannedPairing(top, remaining.get(opponentIndex)));
            remaining.remove(opponentIndex);
            remaining.remove(0);
        }
        return new ScanResult(List.copyOf(pairings), null);
    }

    /**
     * Depth-first search that keeps the top-down preference order but revisits earlier choices.
     * A branch is dropped as soon as some remaining player has no unplayed opponent left in the
     * pool, and the whole search gives up after {@link #MAX_BACKTRACK_STEPS} branches.
     */
    private static final class BacktrackSearch {

        private final int fieldSize;
        private int steps;

        private BacktrackSearch(int fieldSize) {
            this.fieldSize = fieldSize;
        }

        // null when no complete pairing exists for the pool
        private List<PlannedPairing> run(List<Player> pool) {
            if (!everyPlayerHasOpponent(pool)) {
                return null;
            }
            return backtrack(pool);
        }

        private List<PlannedPairing> backtrack(List<Player> pool) {
            if (pool.isEmpty()) {
                return new ArrayList<>();
            }

            Player top = pool.get(0);
            for (int i = 1; i < pool.size(); i++) {
                Player candidate = pool.get(i);
                if (haveMet(top, candidate)) {
                    continue;
                }
                if (++steps > MAX_BACKTRACK_STEPS) {
                    throw SwissPairingException.pairingConflict(
                            "Pairing search for the current field of " + fieldSize
                                    + " players gave up after " + MAX_BACKTRACK_STEPS + " steps"
                    );
                }

                List<Player> rest = new ArrayList<>(pool);
                rest.remove(i);
                rest.remove(0);
                if (!everyPlayerHasOpponent(rest)) {
                    continue;
                }
                List<PlannedPairing> tail = backtrack(rest);
                if (tail != null) {
                    tail.add(0, new PlannedPairing(top, candidate));
                    return tail;
                }
            }
            return null;
        }

        private static boolean everyPlayerHasOpponent(List<Player> pool) {
            for (Player player : pool) {
                boolean found = false;
                for (Player other : pool) {
                    if (other != player && !haveMet(player, other)) {
                        found = true;
                        break;
                    }
                }
                if (!found) {
                    return false;
                }
            }
            return true;
        }
    }

    private static boolean haveMet(Player first, Player second) {
        return first.hasPlayed(second.getPlayerId()) || second.hasPlayed(first.getPlayerId());
    }

    private static List<Player> without(List<Player> players, Player excluded) {
        List<Player> remaining = new ArrayList<>(players.size());
        for (Player player : players) {
            if (!player.getPlayerId().equals(excluded.getPlayerId())) {
                remaining.add(player);
            }
        }
        return remaining;
    }

    private static SwissPairingException stuck(Player stuckPlayer) {
        return SwissPairingException.pairingConflict(
                "No remaining opponent for player " + stuckPlayer.getPlayerId()
                        + " (" + stuckPlayer.getName() + ") without a rematch"
        );
    }

    private static SwissPairingException exhausted(int fieldSize) {
        return SwissPairingException.pairingConflict(
                "No rematch-free pairing exists for the current field of " + fieldSize + " players"
        );
    }

    private static void validatePlayers(List<Player> rankedPlayers) {
        Set<UUID> playerIds = new HashSet<>();
        for (Player player : rankedPlayers) {
            if (player.getPlayerId() == null) {
                throw new IllegalArgumentException("Ranked player is missing playerId");
            }
            if (!playerIds.add(player.getPlayerId())) {
                throw new IllegalArgumentException("Duplicate player in ranking: " + player.getPlayerId());
            }
        }
    }

    public record PairingPlan(
            List<PlannedPairing> pairings,
            Player byePlayer
    ) {
        public boolean hasBye() {
            return byePlayer != null;
        }
    }

    public record PlannedPairing(
            Player player1,
            Player player2
    ) {
    }

    private record ScanResult(
            List<PlannedPairing> pairings,
            Player stuckPlayer
    ) {
        boolean isComplete() {
            return stuckPlayer == null;
        }
    }
}
