package dao.bmn.escrow.model;

public enum EscrowState {
    ACTIVE,
    WITHDRAWN,
    CANCELLED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
