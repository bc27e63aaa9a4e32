package domain.model;

/** Which side of a (predicted, gold) pair a query or warning belongs to. */
public enum QuerySide {
    PREDICTED,
    GOLD
}
