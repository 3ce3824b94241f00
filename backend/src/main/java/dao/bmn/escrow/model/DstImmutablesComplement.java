package dao.bmn.escrow.model;

import java.math.BigInteger;

/**
 * The destination-side fields that differ from the source immutables. Announced with the source
 * escrow so the resolver can build the destination immutables without any other channel.
 */
public record DstImmutablesComplement(
        String maker,
        BigInteger amount,
        String token,
        BigInteger safetyDeposit,
        long chainId,
        byte[] parameters
) {

    /**
     * Destination immutables: same order hash, hashlock, taker and schedule as the source leg.
     */
    public Immutables toDestinationImmutables(Immutables src) {
        return src.toBuilder()
                .maker(maker)
                .token(token)
                .amount(amount)
                .safetyDeposit(safetyDeposit)
                .parameters(parameters == null ? new byte[0] : parameters.clone())
                .build();
    }
}
