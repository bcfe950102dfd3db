package com.swissdraw.repository;

import java.util.UUID;

public interface PlayerStandingRow {

    UUID getPlayerId();

    String getName();

    Double getPoints();

    Integer getMatchesPlayed();
}
