package org.evalux.landlord.dto;

import lombok.*;
import org.evalux.landlord.model.MatchSession;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.rules.FirstBidderRotation;
import org.evalux.landlord.service.engine.MatchAggregator.MatchFold;
import org.evalux.landlord.service.stats.PlayerStatistics;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchView {
    private MatchSummary summary;
    private List<RoundView> rounds;

    // null quand le match est terminé
    private Integer nextBidder;

    // statistiques de chaque place sur ce seul match, dans l'ordre A, B, C
    private List<PlayerStatistics> players;

    public static MatchView of(MatchSession session, MatchFold fold, List<PlayerStatistics> players) {
        List<RoundView> views = new ArrayList<>(session.roundCount());
        for (int i = 0; i < session.roundCount(); i++) {
            views.add(RoundView.of(session.rounds().get(i), fold.scores().get(i), session.initialStarter()));
        }
        Integer next = session.summary().isFinished() ? null : FirstBidderRotation.nextBidder(session);
        return MatchView.builder()
                .summary(session.summary())
                .rounds(views)
                .nextBidder(next)
                .players(players)
                .build();
    }
}
