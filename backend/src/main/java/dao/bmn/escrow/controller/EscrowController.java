package dao.bmn.escrow.controller;

import dao.bmn.escrow.chain.ChainNode;
import dao.bmn.escrow.escrow.BaseEscrow;
import dao.bmn.escrow.escrow.DestinationEscrow;
import dao.bmn.escrow.event.EscrowLogEntry;
import dao.bmn.escrow.event.EscrowWithdrawalEvent;
import dao.bmn.escrow.model.DstEscrowRequest;
import dao.bmn.escrow.model.EscrowActionRequest;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.PredictRequest;
import dao.bmn.escrow.model.TimelockStage;
import dao.bmn.escrow.service.ChainNetwork;
import dao.bmn.escrow.service.SwapService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.web3j.utils.Numeric;

import java.util.*;

/**
 * Escrow lifecycle and journal of one hosted chain.
 */
@Slf4j
@RestController
@RequestMapping("/api/chains/{chainId}")
public class EscrowController {

    private final SwapService swapService;
    private final ChainNetwork network;

    public EscrowController(SwapService swapService, ChainNetwork network) {
        this.swapService = swapService;
        this.network = network;
    }

    /**
     * GET /api/chains/{chainId}/escrows/{hashlock}
     */
    @GetMapping("/escrows/{hashlock}")
    public ResponseEntity<Map<String, Object>> getEscrow(@PathVariable long chainId, @PathVariable String hashlock) {
        BaseEscrow escrow = swapService.escrowByHashlock(chainId, hashlock);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("escrow", buildEscrowInfo(network.node(chainId), escrow));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/chains/{chainId}/escrows/predict
     * Address an escrow with these immutables occupies; nothing is deployed.
     */
    @PostMapping("/escrows/predict")
    public ResponseEntity<Map<String, Object>> predict(@PathVariable long chainId, @Valid @RequestBody PredictRequest req) {
        Immutables im = req.getImmutables().toImmutables();
        String address = swapService.predictAddress(chainId, im, req.getRole());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("chainId", chainId);
        response.put("role", req.getRole());
        response.put("address", address);
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/chains/{chainId}/escrows/destination
     * Resolver deploys and funds the destination leg.
     */
    @PostMapping("/escrows/destination")
    public ResponseEntity<Map<String, Object>> createDestination(@PathVariable long chainId, @Valid @RequestBody DstEscrowRequest req) {
        DestinationEscrow escrow = swapService.createDestination(
                chainId,
                req.getImmutables().toImmutables(),
                req.getSrcCancellationTimestamp(),
                req.getCaller()
        );

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("escrow", buildEscrowInfo(network.node(chainId), escrow));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * POST /api/chains/{chainId}/escrows/{address}/withdraw
     * With {@code target} set, source escrows pay the amount there instead of to the taker.
     */
    @PostMapping("/escrows/{address}/withdraw")
    public ResponseEntity<Map<String, Object>> withdraw(@PathVariable long chainId,
                                                        @PathVariable String address,
                                                        @Valid @RequestBody EscrowActionRequest req) {
        byte[] secret = hexOrNull(req.getSecret());
        if (req.getTarget() != null && !req.getTarget().isBlank()) {
            swapService.withdrawTo(chainId, address, req.getCaller(), secret, req.getTarget());
        } else {
            swapService.withdraw(chainId, address, req.getCaller(), secret);
        }
        return actionResult(chainId, address);
    }

    /**
     * POST /api/chains/{chainId}/escrows/{address}/withdraw-revealed
     * Withdraws with a secret already revealed on any hosted chain, waiting for it up to the reveal timeout.
     */
    @PostMapping("/escrows/{address}/withdraw-revealed")
    public ResponseEntity<Map<String, Object>> withdrawRevealed(@PathVariable long chainId,
                                                                @PathVariable String address,
                                                                @Valid @RequestBody EscrowActionRequest req) {
        EscrowWithdrawalEvent reveal = swapService.withdrawWithRevealedSecret(chainId, address, req.getCaller());
        ResponseEntity<Map<String, Object>> result = actionResult(chainId, address);
        result.getBody().put("revealedOnChain", reveal.chainId());
        return result;
    }

    @PostMapping("/escrows/{address}/public-withdraw")
    public ResponseEntity<Map<String, Object>> publicWithdraw(@PathVariable long chainId,
                                                              @PathVariable String address,
                                                              @Valid @RequestBody EscrowActionRequest req) {
        swapService.publicWithdraw(chainId, address, req.getCaller(), hexOrNull(req.getSecret()), hexOrNull(req.getEndorsement()));
        return actionResult(chainId, address);
    }

    @PostMapping("/escrows/{address}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable long chainId,
                                                      @PathVariable String address,
                                                      @Valid @RequestBody EscrowActionRequest req) {
        swapService.cancel(chainId, address, req.getCaller());
        return actionResult(chainId, address);
    }

    @PostMapping("/escrows/{address}/public-cancel")
    public ResponseEntity<Map<String, Object>> publicCancel(@PathVariable long chainId,
                                                            @PathVariable String address,
                                                            @Valid @RequestBody EscrowActionRequest req) {
        swapService.publicCancel(chainId, address, req.getCaller(), hexOrNull(req.getEndorsement()));
        return actionResult(chainId, address);
    }

    /**
     * GET /api/chains/{chainId}/journal?fromSequence=N
     * Entries after sequence N, oldest first.
     */
    @GetMapping("/journal")
    public ResponseEntity<Map<String, Object>> journal(@PathVariable long chainId,
                                                       @RequestParam(defaultValue = "0") long fromSequence) {
        ChainNode node = network.node(chainId);
        List<EscrowLogEntry> entries = node.getJournal().entriesAfter(fromSequence);

        List<Map<String, Object>> out = new ArrayList<>();
        for (EscrowLogEntry e : entries) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("sequence", e.sequence());
            info.put("emitter", e.emitter());
            info.put("topics", e.topics());
            info.put("data", e.dataHex());
            info.put("timestamp", e.timestamp());
            out.add(info);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("chainId", chainId);
        response.put("latestSequence", node.getJournal().latestSequence());
        response.put("entries", out);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/chains/{chainId}/balances/{token}/{holder}
     */
    @GetMapping("/balances/{token}/{holder}")
    public ResponseEntity<Map<String, Object>> balance(@PathVariable long chainId,
                                                       @PathVariable String token,
                                                       @PathVariable String holder) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("token", token);
        response.put("holder", holder);
        response.put("balance", network.node(chainId).getLedger().balanceOf(token, holder).toString());
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> actionResult(long chainId, String address) {
        BaseEscrow escrow = swapService.escrowAt(chainId, address);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("escrow", buildEscrowInfo(network.node(chainId), escrow));
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> buildEscrowInfo(ChainNode node, BaseEscrow escrow) {
        Immutables im = escrow.getImmutables();
        Map<String, Object> info = new LinkedHashMap<>();

        info.put("address", escrow.getAddress());
        info.put("role", escrow.getRole());
        info.put("state", escrow.getState());
        info.put("digest", escrow.getDigestHex());
        info.put("orderHash", im.getOrderHash());
        info.put("hashlock", escrow.getHashlock());
        info.put("maker", im.getMaker());
        info.put("taker", im.getTaker());
        info.put("token", im.getToken());
        info.put("amount", im.getAmount().toString());
        info.put("safetyDeposit", im.getSafetyDeposit().toString());
        info.put("timelocks", im.getTimelocks().toHex());
        info.put("deployedAt", im.getTimelocks().deployedAt());
        info.put("rescueAt", escrow.rescueInstant());

        Map<String, Object> stages = new LinkedHashMap<>();
        for (TimelockStage stage : TimelockStage.values()) {
            stages.put(stage.name(), escrow.unlockInstant(stage));
        }
        info.put("stages", stages);

        info.put("balance", node.getLedger().balanceOf(im.getToken(), escrow.getAddress()).toString());
        return info;
    }

    private static byte[] hexOrNull(String hex) {
        return hex == null || hex.isBlank() ? null : Numeric.hexStringToByteArray(hex.trim());
    }
}
