package org.evalux.landlord.model;

import java.util.List;

/**
 * Photo immuable d'un match : son résumé et ses manches dans l'ordre.
 * Construite par l'appelant et passée aux calculs, jamais partagée de façon globale.
 */
public record MatchSession(MatchSummary summary, List<RoundRecord> rounds) {

    public MatchSession {
        rounds = List.copyOf(rounds);
    }

    public int roundCount() {
        return rounds.size();
    }

    public int initialStarter() {
        return summary.getInitialStarter();
    }
}
