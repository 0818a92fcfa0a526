package org.evalux.landlord.model;

/**
 * Les trois places autour de la table.
 * index() est 0-based (premier à annoncer, joueur de départ),
 * position() est 1-based (champ "landlord" persisté).
 */
public enum Seat {
    A, B, C;

    public int index() { return ordinal(); }

    public int position() { return ordinal() + 1; }

    public static Seat fromPosition(int position) {
        if (position < 1 || position > 3) throw new IllegalArgumentException("Position invalide: " + position);
        return values()[position - 1];
    }
}
