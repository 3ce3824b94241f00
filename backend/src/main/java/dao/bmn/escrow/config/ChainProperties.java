package dao.bmn.escrow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "chains")
@Data
public class ChainProperties {

    /**
     * Chains hosted by this process. Each gets its own ledger, journal and factory.
     */
    private List<ChainDefinition> definitions = new ArrayList<>();

    @Data
    public static class ChainDefinition {
        /**
         * Chain ID
         * Example: 1 (Ethereum), 8453 (Base)
         */
        private Long id;

        private String name;

        /**
         * Factory address (hex, 0x-prefixed). Use the same value on every chain so escrow
         * addresses line up across chains.
         */
        private String factoryAddress;

        /**
         * Factory owner, allowed to pause and to manage resolvers.
         */
        private String owner;

        /**
         * Token whose holders may call public withdraw / public cancel.
         */
        private String accessToken;

        /**
         * Skip the resolver whitelist on escrow creation.
         * Default: false
         */
        private boolean whitelistBypassed = false;

        /**
         * Whitelisted resolver addresses
         * Example: ["0x70997970c51812dc3a010c7d01b50e0d17dc79c8"]
         */
        private List<String> resolvers = new ArrayList<>();

        /**
         * Balances credited on startup (local development only).
         */
        private List<SeedBalance> balances = new ArrayList<>();
    }

    @Data
    public static class SeedBalance {
        /**
         * Token address; 0x0000000000000000000000000000000000000000 is the native asset.
         */
        private String token;
        private String holder;
        private BigInteger amount;
    }
}
