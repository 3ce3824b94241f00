package dao.bmn.escrow.event;

import dao.bmn.escrow.chain.ChainNode;
import dao.bmn.escrow.config.SchedulerProperties;
import dao.bmn.escrow.service.ChainNetwork;
import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Watches every chain's journal for EscrowWithdrawal entries and remembers the revealed secrets
 * by hashlock.
 * <p>
 * A secret revealed on one chain unlocks the other leg, so the reader does not care which chain
 * or escrow emitted it. Each chain is read incrementally from the last sequence seen.
 */
@Slf4j
@Service
public class SecretRevealReader {

    private final ChainNetwork network;
    private final SchedulerProperties.RevealConfig revealProps;

    // key: chainId -> last journal sequence read
    private final Map<Long, Long> cursors = new ConcurrentHashMap<>();

    // key: hashlock
    private final Map<String, EscrowWithdrawalEvent> revealed = new ConcurrentHashMap<>();

    public SecretRevealReader(ChainNetwork network, SchedulerProperties schedulerProps) {
        this.network = network;
        this.revealProps = schedulerProps.getReveal();
    }

    /**
     * Reads journal entries appended since the last call. Returns how many new reveals were found.
     */
    public synchronized int refresh() {
        int found = 0;
        for (ChainNode node : network.nodes()) {
            long cursor = cursors.getOrDefault(node.getChainId(), 0L);
            for (EscrowLogEntry entry : node.getJournal().entriesAfter(cursor)) {
                cursor = entry.sequence();
                Optional<EscrowWithdrawalEvent> ev = EscrowEventDecoder.escrowWithdrawal(entry);
                if (ev.isPresent() && revealed.putIfAbsent(ev.get().hashlock(), ev.get()) == null) {
                    found++;
                    log.info("Secret revealed on chain {} by {} for hashlock {}",
                            ev.get().chainId(), ev.get().escrow(), ev.get().hashlock());
                }
            }
            cursors.put(node.getChainId(), cursor);
        }
        return found;
    }

    public Optional<EscrowWithdrawalEvent> revealedFor(String hashlock) {
        return Optional.ofNullable(revealed.get(CryptoUtil.normalizeBytes32(hashlock)));
    }

    public Optional<EscrowWithdrawalEvent> readWithTimeout(String hashlock) {
        return readWithTimeout(hashlock,
                Duration.ofSeconds(revealProps.getTimeoutSeconds()),
                Duration.ofMillis(revealProps.getPollInitialMs()));
    }

    public Optional<EscrowWithdrawalEvent> readWithTimeout(String hashlock, Duration timeout, Duration pollInterval) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(50, pollInterval.toMillis());
        long maxSleepMs = Math.max(sleepMs, revealProps.getPollMaxMs());

        while (true) {
            refresh();
            Optional<EscrowWithdrawalEvent> ev = revealedFor(hashlock);
            if (ev.isPresent()) return ev;
            if (System.currentTimeMillis() >= deadline) break;

            log.debug("Secret for {} not revealed yet, next poll in ~{}ms", hashlock, sleepMs);
            // Backoff + jitter so many waiting swaps do not poll in lockstep.
            long jitter = ThreadLocalRandom.current().nextLong(0, 50);
            if (!sleepQuietly(Math.min(sleepMs + jitter, Math.max(0, deadline - System.currentTimeMillis())))) {
                return Optional.empty();
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }

        return Optional.empty();
    }

    private static boolean sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
