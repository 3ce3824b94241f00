package dao.bmn.escrow.model;

public enum EscrowRole {
    SOURCE,
    DESTINATION
}
