package org.evalux.landlord.model.rules;

import org.evalux.landlord.model.MatchSession;

/** Rotation de la place qui annonce en premier : une place de plus à chaque manche. */
public final class FirstBidderRotation {
    private FirstBidderRotation(){}

    public static int firstBidder(int roundIndex, int matchStarter) {
        if (roundIndex < 0) throw new IllegalArgumentException("Index de manche négatif: " + roundIndex);
        if (matchStarter < 0 || matchStarter > 2) throw new IllegalArgumentException("Joueur de départ invalide: " + matchStarter);
        return (roundIndex + matchStarter) % 3;
    }

    public static int nextBidder(MatchSession session) {
        return firstBidder(session.roundCount(), session.initialStarter());
    }

    /**
     * La valeur enregistrée fait foi ; la formule ne sert qu'aux enregistrements qui n'en ont pas.
     */
    public static int effectiveFirstBidder(Integer stored, int roundIndex, int matchStarter) {
        if (stored != null) return stored;
        return firstBidder(roundIndex, matchStarter);
    }
}
