package org.evalux.landlord.service.engine;

import org.evalux.landlord.model.MatchSession;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.RoundRecord;
import org.evalux.landlord.model.ScoreTriple;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Replie la liste ordonnée des manches d'un match en cumuls successifs.
 * Toujours recalculé depuis la première manche : aucune mise à jour incrémentale.
 */
@Service
public class MatchAggregator {

    /**
     * @param scores      cumul après chaque manche (scores.get(n) = somme des manches 0..n)
     * @param maxSnapshot plus haut cumul de chaque place, état initial à 0 compris
     * @param minSnapshot plus bas cumul de chaque place, état initial à 0 compris
     */
    public record MatchFold(List<ScoreTriple> scores, ScoreTriple finalScore, int totalGames,
                            ScoreTriple maxSnapshot, ScoreTriple minSnapshot, MatchSummary summary) {}

    public MatchFold foldMatch(List<RoundRecord> rounds) {
        List<ScoreTriple> scores = new ArrayList<>(rounds.size());
        ScoreTriple running = ScoreTriple.ZERO;
        ScoreTriple max = ScoreTriple.ZERO;
        ScoreTriple min = ScoreTriple.ZERO;
        for (RoundRecord r : rounds) {
            running = running.plus(r.deltas());
            scores.add(running);
            max = max.max(running);
            min = min.min(running);
        }
        return new MatchFold(Collections.unmodifiableList(scores), running, rounds.size(), max, min, null);
    }

    /** Repli complet d'un match ; le résumé retourné est une nouvelle instance, la session n'est pas modifiée. */
    public MatchFold foldMatch(MatchSession session) {
        MatchFold fold = foldMatch(session.rounds());
        MatchSummary summary = copyIdentity(session.summary());
        summary.applyFold(fold.finalScore(), fold.totalGames(), fold.maxSnapshot(), fold.minSnapshot());
        return new MatchFold(fold.scores(), fold.finalScore(), fold.totalGames(),
                fold.maxSnapshot(), fold.minSnapshot(), summary);
    }

    /** Comme foldMatch, puis marque le match comme terminé. */
    public MatchFold finalizeMatch(MatchSession session, LocalDateTime endedAt) {
        MatchFold fold = foldMatch(session);
        fold.summary().setEndedAt(endedAt);
        return fold;
    }

    private static MatchSummary copyIdentity(MatchSummary src) {
        return MatchSummary.builder()
                .id(src.getId())
                .startedAt(src.getStartedAt())
                .endedAt(src.getEndedAt())
                .playerAId(src.getPlayerAId())
                .playerBId(src.getPlayerBId())
                .playerCId(src.getPlayerCId())
                .playerAName(src.getPlayerAName())
                .playerBName(src.getPlayerBName())
                .playerCName(src.getPlayerCName())
                .initialStarter(src.getInitialStarter())
                .build();
    }
}
