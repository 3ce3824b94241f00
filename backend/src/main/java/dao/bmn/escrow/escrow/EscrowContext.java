package dao.bmn.escrow.escrow;

import dao.bmn.escrow.auth.AuthorizationPolicy;
import dao.bmn.escrow.chain.ChainClock;
import dao.bmn.escrow.event.EscrowJournal;
import dao.bmn.escrow.ledger.TokenLedger;

/**
 * Chain-level collaborators shared by every escrow a factory deploys.
 */
public record EscrowContext(
        long chainId,
        TokenLedger ledger,
        EscrowJournal journal,
        ChainClock clock,
        AuthorizationPolicy accessPolicy
) {}
