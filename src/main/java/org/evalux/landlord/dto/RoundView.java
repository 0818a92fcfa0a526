package org.evalux.landlord.dto;

import lombok.*;
import org.evalux.landlord.model.RoundOutcome;
import org.evalux.landlord.model.RoundRecord;
import org.evalux.landlord.model.ScoreTriple;
import org.evalux.landlord.model.Seat;
import org.evalux.landlord.model.rules.FirstBidderRotation;

import java.time.LocalDateTime;

/** Une manche vue par le client : deltas, résultat par place et cumul après la manche. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundView {
    private Long id;
    private int gameIndex;
    private LocalDateTime playedAt;
    private int landlord;
    private int bidA;
    private int bidB;
    private int bidC;
    private boolean doubledA;
    private boolean doubledB;
    private boolean doubledC;
    private int bombs;
    private boolean spring;
    private boolean landlordResult;
    private long scoreA;
    private long scoreB;
    private long scoreC;
    private RoundOutcome outcomeA;
    private RoundOutcome outcomeB;
    private RoundOutcome outcomeC;
    private int firstBidder;
    private ScoreTriple cumulative;

    /**
     * @param initialStarter place de départ du match, pour afficher le premier à annoncer
     *                       des anciens enregistrements qui ne l'ont pas
     */
    public static RoundView of(RoundRecord r, ScoreTriple cumulative, int initialStarter) {
        return RoundView.builder()
                .id(r.getId())
                .gameIndex(r.getGameIndex())
                .playedAt(r.getPlayedAt())
                .landlord(r.getLandlord())
                .bidA(r.bidOf(Seat.A).getPoints())
                .bidB(r.bidOf(Seat.B).getPoints())
                .bidC(r.bidOf(Seat.C).getPoints())
                .doubledA(r.isDoubledA())
                .doubledB(r.isDoubledB())
                .doubledC(r.isDoubledC())
                .bombs(r.getBombs())
                .spring(r.isSpringRound())
                .landlordResult(r.isLandlordResult())
                .scoreA(r.getScoreA())
                .scoreB(r.getScoreB())
                .scoreC(r.getScoreC())
                .outcomeA(r.outcomeOf(Seat.A))
                .outcomeB(r.outcomeOf(Seat.B))
                .outcomeC(r.outcomeOf(Seat.C))
                .firstBidder(FirstBidderRotation.effectiveFirstBidder(
                        r.getFirstBidder(), r.getGameIndex(), initialStarter))
                .cumulative(cumulative)
                .build();
    }
}
