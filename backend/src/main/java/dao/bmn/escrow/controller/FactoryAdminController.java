package dao.bmn.escrow.controller;

import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.escrow.EscrowFactory;
import dao.bmn.escrow.model.AdminRequest;
import dao.bmn.escrow.repository.FactoryRegistry;
import dao.bmn.escrow.service.ChainNetwork;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owner operations of a chain's factory. Every call names the caller; only the owner succeeds.
 */
@RestController
@RequestMapping("/api/chains/{chainId}/admin")
public class FactoryAdminController {

    private final ChainNetwork network;

    public FactoryAdminController(ChainNetwork network) {
        this.network = network;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getFactory(@PathVariable long chainId) {
        return ResponseEntity.ok(factoryInfo(network.node(chainId).getFactory()));
    }

    /**
     * POST /api/chains/{chainId}/admin/pause  {caller, enabled}
     */
    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause(@PathVariable long chainId, @Valid @RequestBody AdminRequest req) {
        EscrowFactory factory = network.node(chainId).getFactory();
        factory.setPaused(req.getCaller(), requireFlag(req));
        return ResponseEntity.ok(factoryInfo(factory));
    }

    /**
     * POST /api/chains/{chainId}/admin/resolvers  {caller, address, enabled}
     * enabled=false removes the resolver.
     */
    @PostMapping("/resolvers")
    public ResponseEntity<Map<String, Object>> resolvers(@PathVariable long chainId, @Valid @RequestBody AdminRequest req) {
        EscrowFactory factory = network.node(chainId).getFactory();
        String resolver = requireAddress(req);
        if (req.getEnabled() == null || req.getEnabled()) {
            factory.addResolver(req.getCaller(), resolver);
        } else {
            factory.removeResolver(req.getCaller(), resolver);
        }
        return ResponseEntity.ok(factoryInfo(factory));
    }

    /**
     * POST /api/chains/{chainId}/admin/bypass  {caller, enabled}
     */
    @PostMapping("/bypass")
    public ResponseEntity<Map<String, Object>> bypass(@PathVariable long chainId, @Valid @RequestBody AdminRequest req) {
        EscrowFactory factory = network.node(chainId).getFactory();
        factory.setWhitelistBypassed(req.getCaller(), requireFlag(req));
        return ResponseEntity.ok(factoryInfo(factory));
    }

    /**
     * POST /api/chains/{chainId}/admin/owner  {caller, address}
     */
    @PostMapping("/owner")
    public ResponseEntity<Map<String, Object>> transferOwnership(@PathVariable long chainId, @Valid @RequestBody AdminRequest req) {
        EscrowFactory factory = network.node(chainId).getFactory();
        factory.transferOwnership(req.getCaller(), requireAddress(req));
        return ResponseEntity.ok(factoryInfo(factory));
    }

    private static boolean requireFlag(AdminRequest req) {
        if (req.getEnabled() == null) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, "enabled is required");
        }
        return req.getEnabled();
    }

    private static String requireAddress(AdminRequest req) {
        if (req.getAddress() == null || req.getAddress().isBlank()) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, "address is required");
        }
        return req.getAddress().trim();
    }

    private static Map<String, Object> factoryInfo(EscrowFactory factory) {
        FactoryRegistry registry = factory.getRegistry();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("chainId", factory.getChainId());
        response.put("factory", factory.getAddress());
        response.put("owner", registry.getOwner());
        response.put("paused", registry.isPaused());
        response.put("whitelistBypassed", registry.isWhitelistBypassed());
        response.put("resolvers", registry.resolvers());
        response.put("escrowCount", registry.allEscrows().size());
        return response;
    }
}
