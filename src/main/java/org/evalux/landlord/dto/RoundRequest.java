package org.evalux.landlord.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.*;
import org.evalux.landlord.model.Bid;
import org.evalux.landlord.model.RoundInput;
import org.evalux.landlord.model.rules.MultiplierEngine;

/** Saisie d'une manche telle qu'envoyée par le client. Annonces en points (0 = ne pas annoncer). */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundRequest {
    @Min(0) @Max(3)
    private int bidA;
    @Min(0) @Max(3)
    private int bidB;
    @Min(0) @Max(3)
    private int bidC;

    private boolean doubledA;
    private boolean doubledB;
    private boolean doubledC;

    @Min(0) @Max(MultiplierEngine.MAX_BOMBS)
    private int bombs;

    private boolean spring;

    // true = le camp du landlord a gagné
    private boolean landlordWins = true;

    public RoundInput toInput() {
        return new RoundInput(
                Bid.fromPoints(bidA), Bid.fromPoints(bidB), Bid.fromPoints(bidC),
                doubledA, doubledB, doubledC,
                bombs, spring, landlordWins);
    }
}
