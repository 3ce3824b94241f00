package dao.bmn.escrow.event;

import dao.bmn.escrow.chain.ChainClock;
import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only log of one chain. Entries are never removed or rewritten; sequence numbers start at
 * 1 and have no gaps, so a reader that remembers the last sequence it saw can replay safely.
 */
@Slf4j
public class EscrowJournal {

    private final long chainId;
    private final ChainClock clock;
    private final List<EscrowLogEntry> entries = new ArrayList<>();

    public EscrowJournal(long chainId, ChainClock clock) {
        this.chainId = chainId;
        this.clock = clock;
    }

    public synchronized EscrowLogEntry append(String emitter, List<String> topics, String dataHex) {
        EscrowLogEntry entry = new EscrowLogEntry(
                entries.size() + 1L,
                chainId,
                CryptoUtil.normalizeAddress(emitter),
                List.copyOf(topics),
                dataHex == null ? "0x" : dataHex,
                clock.now()
        );
        entries.add(entry);
        log.debug("chain {}: journal #{} emitter={} topic0={}", chainId, entry.sequence(), entry.emitter(), entry.topic0());
        return entry;
    }

    /**
     * Entries with sequence strictly greater than {@code afterSequence}, in order.
     */
    public synchronized List<EscrowLogEntry> entriesAfter(long afterSequence) {
        int from = (int) Math.max(0, Math.min(afterSequence, entries.size()));
        return List.copyOf(entries.subList(from, entries.size()));
    }

    public synchronized List<EscrowLogEntry> entriesFor(String emitter) {
        String normalized = CryptoUtil.normalizeAddress(emitter);
        List<EscrowLogEntry> out = new ArrayList<>();
        for (EscrowLogEntry e : entries) {
            if (e.emitter().equals(normalized)) out.add(e);
        }
        return Collections.unmodifiableList(out);
    }

    public synchronized long latestSequence() {
        return entries.size();
    }

    public long getChainId() {
        return chainId;
    }
}
