package dao.bmn.escrow.repository;

import dao.bmn.escrow.escrow.BaseEscrow;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one factory: deployed escrows keyed by hashlock and address, the owner, the
 * resolver whitelist and the pause / bypass switches. Injected into the factory, never global.
 */
public interface FactoryRegistry {

    /**
     * Record a freshly deployed escrow. Returns false, recording nothing, when the hashlock is
     * already taken.
     */
    boolean register(String hashlock, BaseEscrow escrow);

    Optional<String> addressFor(String hashlock);

    Optional<BaseEscrow> escrowAt(String address);

    Collection<BaseEscrow> allEscrows();

    String getOwner();

    void setOwner(String owner);

    boolean isWhitelisted(String resolver);

    void addResolver(String resolver);

    void removeResolver(String resolver);

    Set<String> resolvers();

    boolean isPaused();

    void setPaused(boolean paused);

    boolean isWhitelistBypassed();

    void setWhitelistBypassed(boolean bypassed);
}
