package dao.bmn.escrow.event;

/**
 * A revealed secret. This is the only piece of information that crosses chains.
 */
public record EscrowWithdrawalEvent(
        long sequence,
        long chainId,
        String escrow,
        String secretHex,
        String hashlock
) {}
