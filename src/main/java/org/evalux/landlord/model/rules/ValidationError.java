package org.evalux.landlord.model.rules;

/**
 * Erreur de saisie des annonces, à montrer telle quelle à l'utilisateur.
 *
 * @param level niveau d'annonce en conflit (1..3), null pour NO_BID
 */
public record ValidationError(Kind kind, Integer level, String message) {

    public enum Kind { AMBIGUOUS_BID, NO_BID }

    public static ValidationError ambiguousBid(int level) {
        return new ValidationError(Kind.AMBIGUOUS_BID, level, "Plusieurs joueurs ont annoncé " + level + " point(s)");
    }

    public static ValidationError noBid() {
        return new ValidationError(Kind.NO_BID, null, "Personne n'a annoncé");
    }
}
