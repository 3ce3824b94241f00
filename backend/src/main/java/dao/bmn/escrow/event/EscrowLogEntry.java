package dao.bmn.escrow.event;

import java.util.List;

/**
 * One journal entry, shaped like an EVM log: topics[0] is keccak256 of the event signature,
 * indexed values follow as 32-byte topics, the rest is ABI-encoded in {@code dataHex}.
 */
public record EscrowLogEntry(
        long sequence,
        long chainId,
        String emitter,
        List<String> topics,
        String dataHex,
        long timestamp
) {

    public String topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }
}
