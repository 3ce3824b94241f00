package dao.bmn.escrow.model;

import java.math.BigInteger;

/**
 * Decoded extra parameters of a fill.
 *
 * deposits  = (dstSafetyDeposit << 128) | srcSafetyDeposit
 * timelocks = (srcCancellationTimestamp << 128) | dstWithdrawalTimestamp  (absolute unix seconds)
 */
public record FillExtraData(
        String hashlock,
        long dstChainId,
        String dstToken,
        BigInteger deposits,
        BigInteger timelocks
) {
    private static final BigInteger LOW_128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    public BigInteger srcSafetyDeposit() {
        return deposits.and(LOW_128);
    }

    public BigInteger dstSafetyDeposit() {
        return deposits.shiftRight(128);
    }

    public long srcCancellationTimestamp() {
        return timelocks.shiftRight(128).longValueExact();
    }

    public long dstWithdrawalTimestamp() {
        return timelocks.and(LOW_128).longValueExact();
    }

    public static BigInteger packDeposits(BigInteger dstSafetyDeposit, BigInteger srcSafetyDeposit) {
        return dstSafetyDeposit.shiftLeft(128).or(srcSafetyDeposit);
    }

    public static BigInteger packTimelocks(long srcCancellationTimestamp, long dstWithdrawalTimestamp) {
        return BigInteger.valueOf(srcCancellationTimestamp).shiftLeft(128).or(BigInteger.valueOf(dstWithdrawalTimestamp));
    }
}
