package org.evalux.landlord.model.rules;

import org.evalux.landlord.model.RoundInput;
import org.evalux.landlord.model.ScoreTriple;
import org.evalux.landlord.model.Seat;

/**
 * Applique bombes, printemps et doublements pour obtenir les deltas signés d'une manche.
 * L'ordre des étapes compte : le doublement du landlord s'applique avant le calcul
 * du paiement de chaque paysan.
 */
public final class MultiplierEngine {
    private MultiplierEngine(){}

    public static final int MAX_BOMBS = 10;

    public record RoundModifiers(int bombs, boolean spring, Seat landlord,
                                 boolean doubledA, boolean doubledB, boolean doubledC,
                                 boolean landlordWins) {

        public static RoundModifiers from(RoundInput input, Seat landlord) {
            return new RoundModifiers(input.bombs(), input.spring(), landlord,
                    input.doubledA(), input.doubledB(), input.doubledC(), input.landlordWins());
        }

        public boolean doubledOf(Seat seat) {
            return switch (seat) {
                case A -> doubledA;
                case B -> doubledB;
                case C -> doubledC;
            };
        }
    }

    public static ScoreTriple applyMultipliers(long baseStake, RoundModifiers m) {
        if (m == null || m.landlord() == null) throw new InvalidModifierException("Landlord manquant");
        if (baseStake <= 0) throw new InvalidModifierException("Mise de base invalide: " + baseStake);
        if (m.bombs() < 0 || m.bombs() > MAX_BOMBS) {
            throw new InvalidModifierException("Nombre de bombes hors bornes (0.." + MAX_BOMBS + "): " + m.bombs());
        }

        long stake = baseStake * (1L << m.bombs());
        if (m.spring()) stake *= 2;
        if (m.doubledOf(m.landlord())) stake *= 2;

        long[] deltas = new long[3];
        long landlordTotal = 0;
        for (Seat s : Seat.values()) {
            if (s == m.landlord()) continue;
            long payment = m.doubledOf(s) ? stake * 2 : stake;
            landlordTotal += payment;
            deltas[s.index()] = m.landlordWins() ? -payment : payment;
        }
        deltas[m.landlord().index()] = m.landlordWins() ? landlordTotal : -landlordTotal;

        return new ScoreTriple(deltas[0], deltas[1], deltas[2]);
    }
}
