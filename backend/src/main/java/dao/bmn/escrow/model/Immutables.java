package dao.bmn.escrow.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Frozen parameter record of one escrow. Its digest is both the deployment salt and the
 * commitment every escrow call is checked against.
 */
@Value
public class Immutables {

    String orderHash;       // bytes32 hex
    String hashlock;        // bytes32 hex, keccak256(secret)
    String maker;
    String taker;
    String token;           // 0x00..00 is the native asset
    BigInteger amount;
    BigInteger safetyDeposit;
    Timelocks timelocks;
    byte[] parameters;

    @Builder(toBuilder = true)
    public Immutables(String orderHash, String hashlock, String maker, String taker, String token,
                      BigInteger amount, BigInteger safetyDeposit, Timelocks timelocks, byte[] parameters) {
        this.orderHash = orderHash;
        this.hashlock = hashlock;
        this.maker = maker;
        this.taker = taker;
        this.token = token;
        this.amount = amount;
        this.safetyDeposit = safetyDeposit;
        this.timelocks = timelocks;
        this.parameters = parameters == null ? new byte[0] : parameters.clone();
    }

    public byte[] getParameters() {
        return parameters.clone();
    }

    public Immutables withTimelocks(Timelocks newTimelocks) {
        return toBuilder().timelocks(newTimelocks).build();
    }
}
