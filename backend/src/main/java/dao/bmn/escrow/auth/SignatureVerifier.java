package dao.bmn.escrow.auth;

import java.util.Optional;

/**
 * Recovers the signer address of a signature over a 32-byte digest. Empty when the signature is
 * malformed or does not recover.
 */
public interface SignatureVerifier {

    Optional<String> recover(byte[] digest, byte[] signature);
}
