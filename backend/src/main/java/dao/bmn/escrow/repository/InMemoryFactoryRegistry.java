package dao.bmn.escrow.repository;

import dao.bmn.escrow.escrow.BaseEscrow;
import dao.bmn.escrow.util.CryptoUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryFactoryRegistry implements FactoryRegistry {

    // key: hashlock -> escrow address
    private final Map<String, String> addressByHashlock = new ConcurrentHashMap<>();

    // key: escrow address
    private final Map<String, BaseEscrow> escrowsByAddress = new ConcurrentHashMap<>();

    private final Set<String> resolvers = ConcurrentHashMap.newKeySet();

    private volatile String owner;
    private volatile boolean paused;
    private volatile boolean whitelistBypassed;

    public InMemoryFactoryRegistry(String owner) {
        this.owner = CryptoUtil.normalizeAddress(owner);
    }

    @Override
    public synchronized boolean register(String hashlock, BaseEscrow escrow) {
        String key = CryptoUtil.normalizeBytes32(hashlock);
        if (addressByHashlock.containsKey(key)) {
            return false;
        }
        addressByHashlock.put(key, escrow.getAddress());
        escrowsByAddress.put(escrow.getAddress(), escrow);
        return true;
    }

    @Override
    public Optional<String> addressFor(String hashlock) {
        return Optional.ofNullable(addressByHashlock.get(CryptoUtil.normalizeBytes32(hashlock)));
    }

    @Override
    public Optional<BaseEscrow> escrowAt(String address) {
        return Optional.ofNullable(escrowsByAddress.get(CryptoUtil.normalizeAddress(address)));
    }

    @Override
    public Collection<BaseEscrow> allEscrows() {
        return new ArrayList<>(escrowsByAddress.values());
    }

    @Override
    public String getOwner() {
        return owner;
    }

    @Override
    public void setOwner(String owner) {
        this.owner = CryptoUtil.normalizeAddress(owner);
    }

    @Override
    public boolean isWhitelisted(String resolver) {
        return resolvers.contains(CryptoUtil.normalizeAddress(resolver));
    }

    @Override
    public void addResolver(String resolver) {
        resolvers.add(CryptoUtil.normalizeAddress(resolver));
    }

    @Override
    public void removeResolver(String resolver) {
        resolvers.remove(CryptoUtil.normalizeAddress(resolver));
    }

    @Override
    public Set<String> resolvers() {
        return new TreeSet<>(resolvers);
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    @Override
    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    @Override
    public boolean isWhitelistBypassed() {
        return whitelistBypassed;
    }

    @Override
    public void setWhitelistBypassed(boolean bypassed) {
        this.whitelistBypassed = bypassed;
    }
}
