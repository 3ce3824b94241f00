package dao.bmn.escrow.chain;

/**
 * Block time of one chain, in unix seconds. Chains keep independent clocks.
 */
@FunctionalInterface
public interface ChainClock {

    long now();

    static ChainClock system() {
        return () -> System.currentTimeMillis() / 1000L;
    }
}
