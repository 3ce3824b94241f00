package dao.bmn.escrow.model;

import lombok.EqualsAndHashCode;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;

/**
 * Seven 32-bit stage offsets plus the 32-bit deployment timestamp packed into one uint256 word.
 *
 * Layout (least-significant first):
 * bits   0..31  SrcWithdrawal
 * bits  32..63  SrcPublicWithdrawal
 * bits  64..95  SrcCancellation
 * bits  96..127 SrcPublicCancellation
 * bits 128..159 DstWithdrawal
 * bits 160..191 DstPublicWithdrawal
 * bits 192..223 DstCancellation
 * bits 224..255 deployedAt
 *
 * Values are masked to 32 bits and never validated for ordering here; see
 * {@link #isConventionallyOrdered()}.
 */
@EqualsAndHashCode
public final class Timelocks {

    private static final int DEPLOYED_AT_OFFSET = 224;
    private static final long UINT32_MASK = 0xFFFF_FFFFL;
    private static final BigInteger WORD_MASK = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    private static final BigInteger OFFSETS_MASK = BigInteger.ONE.shiftLeft(DEPLOYED_AT_OFFSET).subtract(BigInteger.ONE);

    public static final Timelocks ZERO = new Timelocks(BigInteger.ZERO);

    private final BigInteger packed;

    private Timelocks(BigInteger packed) {
        this.packed = packed;
    }

    public static Timelocks fromPacked(BigInteger packed) {
        if (packed == null || packed.signum() < 0) {
            throw new IllegalArgumentException("Packed timelocks must be a non-negative integer");
        }
        if (packed.bitLength() > 256) {
            throw new IllegalArgumentException("Packed timelocks exceed 256 bits");
        }
        return new Timelocks(packed);
    }

    /**
     * Pack offsets in {@link TimelockStage} order. The deployment timestamp is left at zero.
     */
    public static Timelocks pack(long... offsets) {
        if (offsets == null || offsets.length != TimelockStage.values().length) {
            throw new IllegalArgumentException("Expected " + TimelockStage.values().length + " offsets");
        }
        BigInteger word = BigInteger.ZERO;
        for (TimelockStage stage : TimelockStage.values()) {
            long v = offsets[stage.ordinal()] & UINT32_MASK;
            word = word.or(BigInteger.valueOf(v).shiftLeft(stage.bitOffset()));
        }
        return new Timelocks(word);
    }

    public static Timelocks pack(Map<TimelockStage, Long> offsets) {
        long[] values = new long[TimelockStage.values().length];
        for (TimelockStage stage : TimelockStage.values()) {
            Long v = offsets.get(stage);
            values[stage.ordinal()] = v == null ? 0L : v;
        }
        return pack(values);
    }

    /**
     * Overwrites bits 224..255 only.
     */
    public Timelocks withDeploymentTimestamp(long timestamp) {
        BigInteger ts = BigInteger.valueOf(timestamp & UINT32_MASK).shiftLeft(DEPLOYED_AT_OFFSET);
        return new Timelocks(packed.and(OFFSETS_MASK).or(ts).and(WORD_MASK));
    }

    public long offset(TimelockStage stage) {
        return packed.shiftRight(stage.bitOffset()).longValue() & UINT32_MASK;
    }

    public long deployedAt() {
        return packed.shiftRight(DEPLOYED_AT_OFFSET).longValue() & UINT32_MASK;
    }

    /**
     * deployedAt + offset(stage). Both operands are 32-bit so a long cannot overflow.
     */
    public long unlockInstant(TimelockStage stage) {
        return deployedAt() + offset(stage);
    }

    public long rescueInstant(long rescueDelay) {
        return deployedAt() + rescueDelay;
    }

    public BigInteger packed() {
        return packed;
    }

    public String toHex() {
        String h = packed.toString(16);
        return "0x" + "0".repeat(64 - h.length()) + h;
    }

    public Map<TimelockStage, Long> offsets() {
        Map<TimelockStage, Long> out = new EnumMap<>(TimelockStage.class);
        for (TimelockStage stage : TimelockStage.values()) {
            out.put(stage, offset(stage));
        }
        return out;
    }

    /**
     * Non-decreasing order per side: withdrawal, public withdrawal, cancellation, public cancellation.
     */
    public boolean isConventionallyOrdered() {
        return offset(TimelockStage.SRC_WITHDRAWAL) <= offset(TimelockStage.SRC_PUBLIC_WITHDRAWAL)
                && offset(TimelockStage.SRC_PUBLIC_WITHDRAWAL) <= offset(TimelockStage.SRC_CANCELLATION)
                && offset(TimelockStage.SRC_CANCELLATION) <= offset(TimelockStage.SRC_PUBLIC_CANCELLATION)
                && offset(TimelockStage.DST_WITHDRAWAL) <= offset(TimelockStage.DST_PUBLIC_WITHDRAWAL)
                && offset(TimelockStage.DST_PUBLIC_WITHDRAWAL) <= offset(TimelockStage.DST_CANCELLATION);
    }

    @Override
    public String toString() {
        return "Timelocks{deployedAt=" + deployedAt() + ", offsets=" + offsets() + "}";
    }
}
