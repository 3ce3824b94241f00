package dao.bmn.escrow.event;

import java.util.List;

/**
 * A fully encoded journal entry that has not been appended yet. Creation paths build it before
 * moving any value, so appending it afterwards cannot fail.
 */
public record PendingLogEntry(String emitter, List<String> topics, String dataHex) {

    public PendingLogEntry {
        topics = List.copyOf(topics);
    }

    public EscrowLogEntry appendTo(EscrowJournal journal) {
        return journal.append(emitter, topics, dataHex);
    }
}
