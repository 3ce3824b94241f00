package dao.bmn.escrow.service;

import dao.bmn.escrow.chain.ChainClock;
import dao.bmn.escrow.chain.ChainNode;
import dao.bmn.escrow.config.ChainProperties;
import dao.bmn.escrow.config.EscrowProperties;
import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.escrow.FactorySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All chains hosted by this process, built from {@code chains.definitions}.
 */
@Slf4j
@Service
public class ChainNetwork {

    private final Map<Long, ChainNode> nodes = new LinkedHashMap<>();

    public ChainNetwork(ChainProperties chainProps, EscrowProperties escrowProps, ChainClock clock) {
        FactorySettings settings = escrowProps.toSettings();

        for (ChainProperties.ChainDefinition def : chainProps.getDefinitions()) {
            if (def.getId() == null) {
                throw new SwapException(ErrorCode.UNKNOWN_CHAIN, "chain definition without id");
            }
            if (nodes.containsKey(def.getId())) {
                throw new SwapException(ErrorCode.UNKNOWN_CHAIN, "duplicate chain id " + def.getId());
            }

            ChainNode node = ChainNode.create(
                    def.getId(),
                    def.getName() != null ? def.getName() : "chain-" + def.getId(),
                    def.getFactoryAddress(),
                    def.getOwner(),
                    def.getAccessToken(),
                    settings,
                    clock
            );
            node.getRegistry().setWhitelistBypassed(def.isWhitelistBypassed());
            for (String resolver : def.getResolvers()) {
                if (resolver == null || resolver.isBlank()) continue;
                node.getRegistry().addResolver(resolver.trim());
            }
            for (ChainProperties.SeedBalance seed : def.getBalances()) {
                BigInteger amount = seed.getAmount() != null ? seed.getAmount() : BigInteger.ZERO;
                node.getLedger().mint(seed.getToken(), seed.getHolder(), amount);
            }
            nodes.put(def.getId(), node);

            log.info("Chain {} ({}) ready: factory={}, resolvers={}, bypass={}, seeded={}",
                    node.getChainId(), node.getName(), node.getFactory().getAddress(),
                    node.getRegistry().resolvers().size(), def.isWhitelistBypassed(), def.getBalances().size());
        }

        if (nodes.isEmpty()) {
            log.warn("ChainNetwork: no chains configured (chains.definitions is empty)");
        }
    }

    public ChainNode node(long chainId) {
        ChainNode node = nodes.get(chainId);
        if (node == null) {
            throw new SwapException(ErrorCode.UNKNOWN_CHAIN, String.valueOf(chainId));
        }
        return node;
    }

    public Collection<ChainNode> nodes() {
        return Collections.unmodifiableCollection(new ArrayList<>(nodes.values()));
    }
}
