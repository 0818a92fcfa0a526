package org.evalux.landlord.model;

/** Résultat d'une manche (ou d'un match) du point de vue d'une place. */
public enum RoundOutcome {
    WIN, LOSS, NEUTRAL;

    public static RoundOutcome of(long delta) {
        if (delta > 0) return WIN;
        if (delta < 0) return LOSS;
        return NEUTRAL;
    }
}
