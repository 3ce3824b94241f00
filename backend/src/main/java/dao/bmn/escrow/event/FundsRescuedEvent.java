package dao.bmn.escrow.event;

import java.math.BigInteger;

public record FundsRescuedEvent(
        long sequence,
        String escrow,
        String token,
        BigInteger amount
) {}
