package dao.bmn.escrow.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Locale;

/**
 * Cryptographic and hex utilities shared by the escrow, factory and codecs.
 *
 * IMPORTANT:
 * - Use SecureRandom for secrets; a predictable secret lets anyone claim the locked value.
 * - Addresses are handled as 0x-prefixed, lower-case, 20-byte hex strings everywhere.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final SecureRandom RNG = new SecureRandom();

    public static final String NATIVE_TOKEN = "0x0000000000000000000000000000000000000000";

    public static byte[] randomBytes32() {
        byte[] secret = new byte[32];
        RNG.nextBytes(secret);
        return secret;
    }

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    /**
     * Hashlock for a secret: keccak256(secret), hex with 0x prefix.
     */
    public static String hashlockOf(byte[] secret) {
        return toHex0x(keccak256(secret));
    }

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    /**
     * Parse a 0x-prefixed (or bare) 32-byte hex value; rejects any other width.
     */
    public static byte[] bytes32(String hex) {
        byte[] raw = Numeric.hexStringToByteArray(cleanHex(hex));
        if (raw.length != 32) {
            throw new IllegalArgumentException("Expected 32 bytes, got " + raw.length + " for " + hex);
        }
        return raw;
    }

    public static String normalizeBytes32(String hex) {
        return toHex0x(bytes32(hex));
    }

    /**
     * Normalize an EVM-style address to 0x + 40 lower-case hex chars.
     */
    public static String normalizeAddress(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Address is null");
        }
        String clean = cleanHex(address.trim()).toLowerCase(Locale.ROOT);
        if (clean.length() > 40) {
            throw new IllegalArgumentException("Address longer than 20 bytes: " + address);
        }
        if (!clean.matches("[0-9a-f]*")) {
            throw new IllegalArgumentException("Address is not hex: " + address);
        }
        return "0x" + "0".repeat(40 - clean.length()) + clean;
    }

    public static byte[] addressBytes(String address) {
        return Numeric.hexStringToByteArray(cleanHex(normalizeAddress(address)));
    }

    public static boolean isNative(String token) {
        return NATIVE_TOKEN.equals(normalizeAddress(token));
    }

    /**
     * True for 0 <= value < 2^256.
     */
    public static boolean isUint256(BigInteger value) {
        return value != null && value.signum() >= 0 && value.bitLength() <= 256;
    }

    public static byte[] uint256ToBytes(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("uint256 value is null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative");
        }
        byte[] raw = value.toByteArray();
        int offset = raw.length > 32 && raw[0] == 0 ? 1 : 0;
        if (raw.length - offset > 32) {
            throw new IllegalArgumentException("uint256 value too large");
        }
        byte[] out = new byte[32];
        System.arraycopy(raw, offset, out, 32 - (raw.length - offset), raw.length - offset);
        return out;
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    public static String cleanHex(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }
}
