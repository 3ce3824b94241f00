package dao.bmn.escrow.service;

import dao.bmn.escrow.auth.EndorsedSignaturePolicy;
import dao.bmn.escrow.auth.PublicAction;
import dao.bmn.escrow.config.EndorsementProperties;
import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Signs public-action endorsements with the resolver key, so a keeper without the access token
 * can still finish a swap.
 */
@Slf4j
@Service
public class EndorsementService {

    private final ECKeyPair keyPair;
    private final String signerAddress;

    public EndorsementService(EndorsementProperties endorsementProps) {
        String privateKey = endorsementProps.getPrivateKey();
        if (privateKey == null || privateKey.isBlank()) {
            log.warn("EndorsementService: no private key configured. Endorsing disabled.");
            this.keyPair = null;
            this.signerAddress = "NOT_CONFIGURED";
        } else {
            this.keyPair = ECKeyPair.create(new BigInteger(CryptoUtil.cleanHex(privateKey.trim()), 16));
            this.signerAddress = CryptoUtil.normalizeAddress(Keys.getAddress(keyPair));
        }
        log.info("EndorsementService initialized: signer={}", signerAddress);
    }

    public boolean isEnabled() {
        return keyPair != null;
    }

    public String getSignerAddress() {
        return signerAddress;
    }

    /**
     * Endorsement for {@code caller} to run {@code action} on one escrow, or empty when no key is
     * configured.
     */
    public Optional<byte[]> endorse(long chainId, String escrow, byte[] immutablesDigest, String caller, PublicAction action) {
        if (keyPair == null) return Optional.empty();
        byte[] digest = EndorsedSignaturePolicy.endorsementDigest(chainId, escrow, immutablesDigest, caller, action);
        return Optional.of(sign(digest, keyPair));
    }

    /**
     * personal_sign over a 32-byte digest, returned as r || s || v (65 bytes).
     */
    public static byte[] sign(byte[] digest, ECKeyPair keyPair) {
        Sign.SignatureData sig = Sign.signPrefixedMessage(digest, keyPair);

        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return out;
    }
}
