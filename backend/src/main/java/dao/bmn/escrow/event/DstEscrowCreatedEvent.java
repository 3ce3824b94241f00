package dao.bmn.escrow.event;

import dao.bmn.escrow.model.Timelocks;

public record DstEscrowCreatedEvent(
        long sequence,
        String escrow,
        String hashlock,
        String taker,
        Timelocks timelocks
) {}
