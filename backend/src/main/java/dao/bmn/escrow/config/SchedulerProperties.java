package dao.bmn.escrow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private KeeperConfig keeper = new KeeperConfig();
    private RevealConfig reveal = new RevealConfig();

    @Data
    public static class KeeperConfig {
        /**
         * Enable/disable the automatic keeper pass
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to look for escrows that can be finished (in milliseconds)
         * Default: 5000ms (5 seconds)
         */
        private long checkIntervalMs = 5000;

        /**
         * Address the keeper acts as. It needs the access token (or an endorsement) for public
         * actions, and cancels destination escrows where it is the taker.
         */
        private String keeperAddress;
    }

    @Data
    public static class RevealConfig {
        /**
         * Timeout for waiting on a secret reveal.
         */
        private long timeoutSeconds = 60;

        /**
         * Initial poll interval for the journal (backoff starts here).
         */
        private long pollInitialMs = 250;

        /**
         * Maximum poll interval (backoff cap).
         */
        private long pollMaxMs = 2000;
    }
}
