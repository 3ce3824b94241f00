package dao.bmn.escrow.auth;

import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Optional;

/**
 * secp256k1 recovery of Ethereum personal-sign signatures:
 * signedHash = keccak256("\x19Ethereum Signed Message:\n32" ++ digest).
 */
@Slf4j
public class EcdsaSignatureVerifier implements SignatureVerifier {

    @Override
    public Optional<String> recover(byte[] digest, byte[] signature) {
        if (digest == null || digest.length != 32 || signature == null || signature.length != 65) {
            return Optional.empty();
        }
        byte v = signature[64];
        if (v < 27) v += 27;
        Sign.SignatureData sig = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64)
        );
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, sig);
            return Optional.of(CryptoUtil.normalizeAddress(Keys.getAddress(publicKey)));
        } catch (SignatureException | IllegalArgumentException e) {
            log.debug("Signature recovery failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
