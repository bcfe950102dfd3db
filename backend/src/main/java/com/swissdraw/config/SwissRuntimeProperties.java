package com.swissdraw.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Pairing and standings behaviour switches.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "swiss")
public class SwissRuntimeProperties {

    private Pairing pairing = new Pairing();
    private Standings standings = new Standings();

    @Getter
    @Setter
    public static class Pairing {
        /**
         * Retry with a depth-first search when the forward scan cannot pair every player.
         * When false a stuck scan is reported as a pairing conflict.
         */
        private boolean backtrackingFallback = false;
    }

    @Getter
    @Setter
    public static class Standings {
        /**
         * Also refresh opp_win for every player who has faced a player whose points changed.
         */
        private boolean cascadeOppWinRefresh = true;
    }
}
