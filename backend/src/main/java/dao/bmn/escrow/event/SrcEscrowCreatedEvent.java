package dao.bmn.escrow.event;

import dao.bmn.escrow.model.DstImmutablesComplement;
import dao.bmn.escrow.model.Immutables;

public record SrcEscrowCreatedEvent(
        long sequence,
        String escrow,
        Immutables srcImmutables,
        DstImmutablesComplement dstComplement
) {}
