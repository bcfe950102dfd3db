package com.swissdraw.service;

import com.swissdraw.model.Player;
import com.swissdraw.web.SwissPairingException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SwissPairingPlannerTest {

    private final SwissPairingPlanner planner = new SwissPairingPlanner();

    @Test
    void planPairsFreshFieldTopDownInRankingOrder() {
        Player alice = player("00000000-0000-0000-0000-000000000A01", "Alice");
        Player bob = player("00000000-0000-0000-0000-000000000A02", "Bob");
        Player carol = player("00000000-0000-0000-0000-000000000A03", "Carol");
        Player dave = player("00000000-0000-0000-0000-000000000A04", "Dave");

        SwissPairingPlanner.PairingPlan plan = planner.plan(List.of(alice, bob, carol, dave), false);

        assertFalse(plan.hasBye());
        assertEquals(2, plan.pairings().size());
        assertPairing(plan.pairings().get(0), alice, bob);
        assertPairing(plan.pairings().get(1), carol, dave);
    }

    @Test
    void planSkipsPriorOpponentsWhenScanningForward() {
        Player alice = player("00000000-0000-0000-0000-000000000B01", "Alice");
        Player bob = player("00000000-0000-0000-0000-000000000B02", "Bob");
        Player carol = player("00000000-0000-0000-0000-000000000B03", "Carol");
        Player dave = player("00000000-0000-0000-0000-000000000B04", "Dave");
        played(alice, bob);
        played(carol, dave);

        // standings after Alice beat Bob and Carol drew Dave
        SwissPairingPlanner.PairingPlan plan = planner.plan(List.of(alice, carol, dave, bob), false);

        assertPairing(plan.pairings().get(0), alice, carol);
        assertPairing(plan.pairings().get(1), dave, bob);
    }

    @Test
    void planGivesByeToLowestRankedPlayerInOddField() {
        List<Player> ranked = List.of(
                player("00000000-0000-0000-0000-000000000C01", "Alice"),
                player("00000000-0000-0000-0000-000000000C02", "Bob"),
                player("00000000-0000-0000-0000-000000000C03", "Carol"),
                player("00000000-0000-0000-0000-000000000C04", "Dave"),
                player("00000000-0000-0000-0000-000000000C05", "Erin")
        );

        SwissPairingPlanner.PairingPlan plan = planner.plan(ranked, false);

        assertSame(ranked.get(4), plan.byePlayer());
        assertEquals(2, plan.pairings().size());
        assertPairing(plan.pairings().get(0), ranked.get(0), ranked.get(1));
        assertPairing(plan.pairings().get(1), ranked.get(2), ranked.get(3));
    }

    @Test
    void planMovesByeUpwardPastPlayersWhoAlreadyHadOne() {
        List<Player> ranked = List.of(
                player("00000000-0000-0000-0000-000000000D01", "Alice"),
                player("00000000-0000-0000-0000-000000000D02", "Bob"),
                player("00000000-0000-0000-0000-000000000D03", "Carol")
        );
        ranked.get(2).setHadBye(true);
        ranked.get(1).setHadBye(true);

        SwissPairingPlanner.PairingPlan plan = planner.plan(ranked, false);

        assertSame(ranked.get(0), plan.byePlayer());
        assertEquals(1, plan.pairings().size());
        assertPairing(plan.pairings().get(0), ranked.get(1), ranked.get(2));
    }

    @Test
    void planFailsWhenEveryPlayerInOddFieldAlreadyHadBye() {
        List<Player> ranked = List.of(
                player("00000000-0000-0000-0000-000000000E01", "Alice"),
                player("00000000-0000-0000-0000-000000000E02", "Bob"),
                player("00000000-0000-0000-0000-000000000E03", "Carol")
        );
        ranked.forEach(p -> p.setHadBye(true));

        SwissPairingException ex = assertThrows(SwissPairingException.class, () -> planner.plan(ranked, true));

        assertEquals("no_eligible_player_for_bye", ex.getCode());
        assertEquals("Every one of the 3 players has already received a bye", ex.getMessage());
    }

    @Test
    void planReportsConflictWhenForwardScanGetsStuck() {
        Player alice = player("00000000-0000-0000-0000-000000000F01", "Alice");
        Player bob = player("00000000-0000-0000-0000-000000000F02", "Bob");
        Player carol = player("00000000-0000-0000-0000-000000000F03", "Carol");
        Player dave = player("00000000-0000-0000-0000-000000000F04", "Dave");
        played(carol, dave);

        SwissPairingException ex = assertThrows(
                SwissPairingException.class,
                () -> planner.plan(List.of(alice, bob, carol, dave), false)
        );

        assertEquals("pairing_conflict", ex.getCode());
        assertTrue(ex.getMessage().contains(carol.getPlayerId().toString()));
    }

    @Test
    void planFallsBackToBacktrackingWhenEnabled() {
        Player alice = player("00000000-0000-0000-0000-000000000F11", "Alice");
        Player bob = player("00000000-0000-0000-0000-000000000F12", "Bob");
        Player carol = player("00000000-0000-0000-0000-000000000F13", "Carol");
        Player dave = player("00000000-0000-0000-0000-000000000F14", "Dave");
        played(carol, dave);

        SwissPairingPlanner.PairingPlan plan = planner.plan(List.of(alice, bob, carol, dave), true);

        assertPairing(plan.pairings().get(0), alice, carol);
        assertPairing(plan.pairings().get(1), bob, dave);
    }

    @Test
    void backtrackingTriesAnotherByeCandidateWhenTheFirstLeavesNoPairing() {
        Player alice = player("00000000-0000-0000-0000-000000000F21", "Alice");
        Player bob = player("00000000-0000-0000-0000-000000000F22", "Bob");
        Player carol = player("00000000-0000-0000-0000-000000000F23", "Carol");
        played(alice, bob);

        assertThrows(SwissPairingException.class, () -> planner.plan(List.of(alice, bob, carol), false));

        SwissPairingPlanner.PairingPlan plan = planner.plan(List.of(alice, bob, carol), true);

        assertSame(bob, plan.byePlayer());
        assertPairing(plan.pairings().get(0), alice, carol);
    }

    @Test
    void backtrackingStillReportsConflictWhenNoRematchFreePairingExists() {
        Player alice = player("00000000-0000-0000-0000-000000000F31", "Alice");
        Player bob = player("00000000-0000-0000-0000-000000000F32", "Bob");
        Player carol = player("00000000-0000-0000-0000-000000000F33", "Carol");
        Player dave = player("00000000-0000-0000-0000-000000000F34", "Dave");
        played(alice, bob);
        played(alice, carol);
        played(alice, dave);

        SwissPairingException ex = assertThrows(
                SwissPairingException.class,
                () -> planner.plan(List.of(alice, bob, carol, dave), true)
        );

        assertEquals("pairing_conflict", ex.getCode());
        assertEquals("No rematch-free pairing exists for the current field of 4 players", ex.getMessage());
    }

    @Test
    void backtrackingGivesUpQuicklyWhenBottomPlayerHasFacedEveryone() {
        List<Player> field = field(24, "00000000-0000-0000-0000-0000000020");
        Player bottom = field.get(23);
        for (int i = 0; i < 23; i++) {
            played(field.get(i), bottom);
        }

        assertThrows(SwissPairingException.class, () -> planner.plan(field, false));

        SwissPairingException ex = assertTimeoutPreemptively(
                Duration.ofSeconds(5),
                () -> assertThrows(SwissPairingException.class, () -> planner.plan(field, true))
        );
        assertEquals("pairing_conflict", ex.getCode());
    }

    @Test
    void backtrackingStopsAtStepLimitWhenFieldSplitsIntoOddGroups() {
        List<Player> field = field(24, "00000000-0000-0000-0000-0000000021");
        // two odd groups where every cross-group pair has already met, so no perfect pairing exists
        List<Player> firstGroup = new ArrayList<>();
        List<Player> secondGroup = new ArrayList<>();
        for (int i = 0; i < field.size(); i++) {
            (i % 2 == 0 || i == 1 ? firstGroup : secondGroup).add(field.get(i));
        }
        for (Player first : firstGroup) {
            for (Player second : secondGroup) {
                played(first, second);
            }
        }
        assertEquals(13, firstGroup.size());
        assertEquals(11, secondGroup.size());

        SwissPairingException ex = assertTimeoutPreemptively(
                Duration.ofSeconds(10),
                () -> assertThrows(SwissPairingException.class, () -> planner.plan(field, true))
        );
        assertEquals("pairing_conflict", ex.getCode());
    }

    @Test
    void planHandlesEmptyAndSinglePlayerFields() {
        SwissPairingPlanner.PairingPlan empty = planner.plan(List.of(), false);
        assertTrue(empty.pairings().isEmpty());
        assertNull(empty.byePlayer());

        Player solo = player("00000000-0000-0000-0000-000000000F41", "Solo");
        SwissPairingPlanner.PairingPlan single = planner.plan(List.of(solo), false);
        assertTrue(single.pairings().isEmpty());
        assertSame(solo, single.byePlayer());
    }

    @Test
    void planRejectsDuplicatePlayers() {
        Player alice = player("00000000-0000-0000-0000-000000000F51", "Alice");

        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> planner.plan(List.of(alice, alice), false)
        );

        assertEquals("Duplicate player in ranking: " + alice.getPlayerId(), ex.getMessage());
    }

    @Test
    void roundsOfEightPlayerFieldNeverRepeatOpponentsOrReusePlayers() {
        List<Player> field = field(8, "00000000-0000-0000-0000-0000000010");

        for (int round = 1; round <= 5; round++) {
            playRound(planner.plan(field, true), 8, round);
        }
    }

    @Test
    void forwardScanRoundsNeverRepeatOpponentsAndFailRatherThanForceRematch() {
        List<Player> field = field(8, "00000000-0000-0000-0000-0000000011");

        int completedRounds = 0;
        for (int round = 1; round <= 7; round++) {
            SwissPairingPlanner.PairingPlan plan;
            try {
                plan = planner.plan(field, false);
            } catch (SwissPairingException ex) {
                assertEquals("pairing_conflict", ex.getCode());
                break;
            }
            playRound(plan, 8, round);
            completedRounds++;
        }
        assertTrue(completedRounds >= 5, "forward scan completed only " + completedRounds + " rounds");
    }

    private static void playRound(SwissPairingPlanner.PairingPlan plan, int fieldSize, int round) {
        Set<UUID> seen = new HashSet<>();
        for (SwissPairingPlanner.PlannedPairing pairing : plan.pairings()) {
            assertFalse(pairing.player1().hasPlayed(pairing.player2().getPlayerId()));
            assertFalse(pairing.player2().hasPlayed(pairing.player1().getPlayerId()));
            assertTrue(seen.add(pairing.player1().getPlayerId()));
            assertTrue(seen.add(pairing.player2().getPlayerId()));
            played(pairing.player1(), pairing.player2());
        }
        assertEquals(fieldSize, seen.size(), "round " + round + " should seat every player");
    }

    private static List<Player> field(int size, String idPrefix) {
        List<Player> field = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            field.add(player(idPrefix + String.format("%02d", i), "Player " + String.format("%02d", i)));
        }
        return field;
    }

    private static void assertPairing(SwissPairingPlanner.PlannedPairing pairing, Player expected1, Player expected2) {
        assertSame(expected1, pairing.player1());
        assertSame(expected2, pairing.player2());
    }

    private static void played(Player first, Player second) {
        first.getPrevOpponents().add(second.getPlayerId());
        second.getPrevOpponents().add(first.getPlayerId());
    }

    private static Player player(String playerId, String name) {
        Player player = new Player();
        player.setPlayerId(UUID.fromString(playerId));
        player.setTournamentId(UUID.fromString("00000000-0000-0000-0000-000000000999"));
        player.setName(name);
        return player;
    }
}
