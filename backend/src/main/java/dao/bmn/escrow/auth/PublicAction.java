package dao.bmn.escrow.auth;

/**
 * Escrow actions open to any authorized keeper once their public window starts.
 * The id is part of the endorsement digest.
 */
public enum PublicAction {
    PUBLIC_WITHDRAW(1),
    PUBLIC_CANCEL(2);

    private final int id;

    PublicAction(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }
}
