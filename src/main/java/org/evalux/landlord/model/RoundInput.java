package org.evalux.landlord.model;

/**
 * Saisie brute d'une manche, avant résolution. N'est jamais persistée.
 *
 * @param landlordWins true si le camp du landlord a gagné
 */
public record RoundInput(
        Bid bidA, Bid bidB, Bid bidC,
        boolean doubledA, boolean doubledB, boolean doubledC,
        int bombs,
        boolean spring,
        boolean landlordWins) {

    public Bid bidOf(Seat seat) {
        return switch (seat) {
            case A -> bidA;
            case B -> bidB;
            case C -> bidC;
        };
    }

    public boolean doubledOf(Seat seat) {
        return switch (seat) {
            case A -> doubledA;
            case B -> doubledB;
            case C -> doubledC;
        };
    }
}
