package dao.bmn.escrow.model;

import java.math.BigInteger;

/**
 * The minimal view of an order-protocol order the factory needs when a fill completes.
 * {@code receiver} may be null, meaning the maker receives the destination funds.
 */
public record Order(
        String orderHash,
        BigInteger salt,
        String maker,
        String receiver,
        String makerAsset,
        String takerAsset,
        BigInteger makingAmount,
        BigInteger takingAmount
) {

    public String effectiveReceiver() {
        return receiver == null || receiver.isBlank() ? maker : receiver;
    }
}
