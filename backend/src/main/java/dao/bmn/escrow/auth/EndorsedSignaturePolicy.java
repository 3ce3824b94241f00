package dao.bmn.escrow.auth;

import dao.bmn.escrow.repository.FactoryRegistry;
import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Optional;

/**
 * A caller may act when it presents an endorsement signed by a whitelisted resolver.
 *
 * digest = keccak256(abi.encodePacked(escrow, immutablesDigest, caller, uint8 action, uint256 chainId))
 * signature = personal_sign(digest)
 *
 * The caller is part of the digest, so an endorsement cannot be replayed by someone else.
 */
@Slf4j
public class EndorsedSignaturePolicy implements AuthorizationPolicy {

    private final FactoryRegistry registry;
    private final SignatureVerifier verifier;

    public EndorsedSignaturePolicy(FactoryRegistry registry, SignatureVerifier verifier) {
        this.registry = registry;
        this.verifier = verifier;
    }

    @Override
    public boolean permits(AccessRequest request) {
        if (!request.hasEndorsement()) return false;
        byte[] digest = endorsementDigest(request.chainId(), request.escrow(), request.immutablesDigest(),
                request.caller(), request.action());
        Optional<String> signer = verifier.recover(digest, request.endorsement());
        if (signer.isEmpty()) return false;
        boolean ok = registry.isWhitelisted(signer.get());
        if (!ok) {
            log.debug("Endorsement for {} signed by non-whitelisted {}", request.caller(), signer.get());
        }
        return ok;
    }

    public static byte[] endorsementDigest(long chainId, String escrow, byte[] immutablesDigest,
                                           String caller, PublicAction action) {
        if (immutablesDigest == null || immutablesDigest.length != 32) {
            throw new IllegalArgumentException("Immutables digest must be 32 bytes");
        }
        byte[] packed = CryptoUtil.concat(
                CryptoUtil.addressBytes(escrow),
                immutablesDigest,
                CryptoUtil.addressBytes(caller),
                new byte[]{(byte) action.id()},
                CryptoUtil.uint256ToBytes(BigInteger.valueOf(chainId))
        );
        return CryptoUtil.keccak256(packed);
    }
}
