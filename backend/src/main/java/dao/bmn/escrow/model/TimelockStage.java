package dao.bmn.escrow.model;

/**
 * Timelock stages in packing order; {@link #ordinal()} times 32 is the bit offset of the stage
 * inside the packed word.
 */
public enum TimelockStage {
    SRC_WITHDRAWAL,
    SRC_PUBLIC_WITHDRAWAL,
    SRC_CANCELLATION,
    SRC_PUBLIC_CANCELLATION,
    DST_WITHDRAWAL,
    DST_PUBLIC_WITHDRAWAL,
    DST_CANCELLATION;

    public int bitOffset() {
        return ordinal() * 32;
    }
}
