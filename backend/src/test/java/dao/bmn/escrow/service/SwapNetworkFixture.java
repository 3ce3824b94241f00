package dao.bmn.escrow.service;

import dao.bmn.escrow.chain.ChainClock;
import dao.bmn.escrow.config.ChainProperties;
import dao.bmn.escrow.config.EscrowProperties;
import dao.bmn.escrow.model.FillExtraData;
import dao.bmn.escrow.model.Order;

import java.math.BigInteger;
import java.util.List;

import static dao.bmn.escrow.TestFixtures.*;

/**
 * Two local chains: 1 holds the maker's TOKEN_A, 8453 holds the resolver's TOKEN_B.
 * KEEPER holds the access token on both.
 */
final class SwapNetworkFixture {
    private SwapNetworkFixture() {}

    static final long SRC_CHAIN = 1;
    static final long DST_CHAIN = 8453;

    static ChainNetwork network(ChainClock clock) {
        ChainProperties props = new ChainProperties();
        props.setDefinitions(List.of(
                chain(SRC_CHAIN, "ethereum-local", List.of(
                        seed(TOKEN_A, MAKER, 1000),
                        seed(NATIVE, RESOLVER, 10),
                        seed(ACCESS_TOKEN, KEEPER, 1))),
                chain(DST_CHAIN, "base-local", List.of(
                        seed(TOKEN_B, RESOLVER, 1000),
                        seed(NATIVE, RESOLVER, 10),
                        seed(ACCESS_TOKEN, KEEPER, 1)))
        ));
        ChainNetwork network = new ChainNetwork(props, new EscrowProperties(), clock);
        network.node(SRC_CHAIN).getLedger().approve(TOKEN_A, MAKER, FACTORY, big(1000));
        network.node(DST_CHAIN).getLedger().approve(TOKEN_B, RESOLVER, FACTORY, big(1000));
        return network;
    }

    static Order order() {
        return new Order(ORDER_HASH, BigInteger.ONE, MAKER, null, TOKEN_A, TOKEN_B, big(100), big(200));
    }

    /**
     * Source cancellation at {@code start + 3600}, destination withdrawal at {@code start + 10}.
     */
    static FillExtraData extra(String hashlock, long start) {
        return new FillExtraData(hashlock, DST_CHAIN, TOKEN_B,
                FillExtraData.packDeposits(big(2), big(1)),
                FillExtraData.packTimelocks(start + 3600, start + 10));
    }

    private static ChainProperties.ChainDefinition chain(long id, String name, List<ChainProperties.SeedBalance> seeds) {
        ChainProperties.ChainDefinition def = new ChainProperties.ChainDefinition();
        def.setId(id);
        def.setName(name);
        def.setFactoryAddress(FACTORY);
        def.setOwner(OWNER);
        def.setAccessToken(ACCESS_TOKEN);
        def.setResolvers(List.of(RESOLVER));
        def.setBalances(seeds);
        return def;
    }

    private static ChainProperties.SeedBalance seed(String token, String holder, long amount) {
        ChainProperties.SeedBalance seed = new ChainProperties.SeedBalance();
        seed.setToken(token);
        seed.setHolder(holder);
        seed.setAmount(big(amount));
        return seed;
    }
}
