package dao.bmn.escrow.escrow;

import dao.bmn.escrow.model.EscrowRole;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.TimelockStage;

/**
 * Escrow on the taker's chain. Funded by the taker; a withdrawal pays the maker and reveals the
 * secret, a cancellation returns the funds to the taker. There is no public cancellation here.
 */
public class DestinationEscrow extends BaseEscrow {

    public DestinationEscrow(String address, String factory, Immutables immutables, long rescueDelay, EscrowContext context) {
        super(address, factory, immutables, rescueDelay, context);
    }

    @Override
    public EscrowRole getRole() {
        return EscrowRole.DESTINATION;
    }

    @Override
    protected TimelockStage withdrawalStage() {
        return TimelockStage.DST_WITHDRAWAL;
    }

    @Override
    protected TimelockStage publicWithdrawalStage() {
        return TimelockStage.DST_PUBLIC_WITHDRAWAL;
    }

    @Override
    protected TimelockStage cancellationStage() {
        return TimelockStage.DST_CANCELLATION;
    }

    @Override
    protected String withdrawalRecipient(Immutables im) {
        return im.getMaker();
    }

    @Override
    protected String refundRecipient(Immutables im) {
        return im.getTaker();
    }
}
