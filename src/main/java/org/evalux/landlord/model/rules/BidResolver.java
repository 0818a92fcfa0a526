package org.evalux.landlord.model.rules;

import org.evalux.landlord.model.Bid;
import org.evalux.landlord.model.RoundInput;
import org.evalux.landlord.model.Seat;

import java.util.ArrayList;
import java.util.List;

/**
 * Détermine le landlord et la mise de base à partir des trois annonces.
 * On parcourt les niveaux de 3 à 1 : seul le plus haut niveau annoncé compte,
 * une égalité à un niveau inférieur est sans effet.
 */
public final class BidResolver {
    private BidResolver(){}

    public static final long BASE_UNIT = 100;

    public record BidResolution(Seat landlord, long baseStake, ValidationError error) {
        public static BidResolution ok(Seat landlord, long baseStake) {
            return new BidResolution(landlord, baseStake, null);
        }
        public static BidResolution failure(ValidationError error) {
            return new BidResolution(null, 0, error);
        }
        public boolean isValid() { return error == null; }
    }

    public static BidResolution resolveBids(RoundInput input) {
        return resolveBids(input.bidA(), input.bidB(), input.bidC());
    }

    public static BidResolution resolveBids(Bid a, Bid b, Bid c) {
        Bid[] bids = { orNone(a), orNone(b), orNone(c) };
        for (int level = 3; level >= 1; level--) {
            List<Seat> atLevel = new ArrayList<>(3);
            for (Seat s : Seat.values()) {
                if (bids[s.index()].getPoints() == level) atLevel.add(s);
            }
            if (atLevel.isEmpty()) continue;
            if (atLevel.size() > 1) return BidResolution.failure(ValidationError.ambiguousBid(level));
            return BidResolution.ok(atLevel.get(0), BASE_UNIT * level);
        }
        return BidResolution.failure(ValidationError.noBid());
    }

    private static Bid orNone(Bid b) {
        return b == null ? Bid.NONE : b;
    }
}
