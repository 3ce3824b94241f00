package dao.bmn.escrow.service;

import dao.bmn.escrow.auth.PublicAction;
import dao.bmn.escrow.chain.ChainNode;
import dao.bmn.escrow.config.SchedulerProperties;
import dao.bmn.escrow.escrow.BaseEscrow;
import dao.bmn.escrow.escrow.SourceEscrow;
import dao.bmn.escrow.event.EscrowWithdrawalEvent;
import dao.bmn.escrow.event.SecretRevealReader;
import dao.bmn.escrow.model.EscrowRole;
import dao.bmn.escrow.model.EscrowState;
import dao.bmn.escrow.model.TimelockStage;
import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.util.Optional;

/**
 * Finishes swaps nobody else finishes, collecting the safety deposits as payment:
 * <ul>
 *   <li>public withdraw once the secret is known and the public window is open</li>
 *   <li>public cancel of source escrows after SrcPublicCancellation</li>
 *   <li>cancel of destination escrows where the keeper itself is the taker</li>
 * </ul>
 */
@Slf4j
@Service
public class KeeperService {

    private final ChainNetwork network;
    private final SecretRevealReader revealReader;
    private final EndorsementService endorsementService;
    private final SchedulerProperties schedulerProps;

    public KeeperService(ChainNetwork network,
                         SecretRevealReader revealReader,
                         EndorsementService endorsementService,
                         SchedulerProperties schedulerProps) {
        this.network = network;
        this.revealReader = revealReader;
        this.endorsementService = endorsementService;
        this.schedulerProps = schedulerProps;
    }

    /**
     * One pass over every active escrow on every chain. Returns the number of escrows finished.
     */
    public int runOnce() {
        String keeper = schedulerProps.getKeeper().getKeeperAddress();
        if (keeper == null || keeper.isBlank()) {
            log.debug("Keeper address not configured, skipping pass");
            return 0;
        }
        keeper = CryptoUtil.normalizeAddress(keeper);

        revealReader.refresh();

        int finished = 0;
        for (ChainNode node : network.nodes()) {
            long now = node.getClock().now();
            for (BaseEscrow escrow : node.getFactory().getRegistry().allEscrows()) {
                if (escrow.getState() != EscrowState.ACTIVE) continue;
                if (processOne(node, escrow, keeper, now)) finished++;
            }
        }
        if (finished > 0) {
            log.info("Keeper pass finished {} escrow(s)", finished);
        }
        return finished;
    }

    private boolean processOne(ChainNode node, BaseEscrow escrow, String keeper, long now) {
        boolean source = escrow.getRole() == EscrowRole.SOURCE;
        TimelockStage publicWithdrawal = source ? TimelockStage.SRC_PUBLIC_WITHDRAWAL : TimelockStage.DST_PUBLIC_WITHDRAWAL;
        TimelockStage cancellation = source ? TimelockStage.SRC_CANCELLATION : TimelockStage.DST_CANCELLATION;

        try {
            Optional<EscrowWithdrawalEvent> reveal = revealReader.revealedFor(escrow.getHashlock());
            if (reveal.isPresent()
                    && now >= escrow.unlockInstant(publicWithdrawal)
                    && now < escrow.unlockInstant(cancellation)) {
                byte[] secret = Numeric.hexStringToByteArray(reveal.get().secretHex());
                byte[] endorsement = endorsementFor(node, escrow, keeper, PublicAction.PUBLIC_WITHDRAW);
                escrow.publicWithdraw(keeper, secret, escrow.getImmutables(), endorsement);
                log.info("Keeper withdrew {} escrow {} on chain {}", escrow.getRole(), escrow.getAddress(), node.getChainId());
                return true;
            }

            if (source && now >= escrow.unlockInstant(TimelockStage.SRC_PUBLIC_CANCELLATION)) {
                byte[] endorsement = endorsementFor(node, escrow, keeper, PublicAction.PUBLIC_CANCEL);
                ((SourceEscrow) escrow).publicCancel(keeper, escrow.getImmutables(), endorsement);
                log.info("Keeper cancelled source escrow {} on chain {}", escrow.getAddress(), node.getChainId());
                return true;
            }

            if (!source
                    && now >= escrow.unlockInstant(TimelockStage.DST_CANCELLATION)
                    && keeper.equals(CryptoUtil.normalizeAddress(escrow.getImmutables().getTaker()))) {
                escrow.cancel(keeper, escrow.getImmutables());
                log.info("Keeper cancelled destination escrow {} on chain {}", escrow.getAddress(), node.getChainId());
                return true;
            }
        } catch (Exception e) {
            log.warn("Keeper action on escrow {} (chain {}) rejected: {}", escrow.getAddress(), node.getChainId(), e.getMessage());
        }
        return false;
    }

    private byte[] endorsementFor(ChainNode node, BaseEscrow escrow, String keeper, PublicAction action) {
        return endorsementService.endorse(
                node.getChainId(),
                escrow.getAddress(),
                Numeric.hexStringToByteArray(escrow.getDigestHex()),
                keeper,
                action
        ).orElse(null);
    }
}
