package org.evalux.landlord.service.stats;

import lombok.extern.slf4j.Slf4j;
import org.evalux.landlord.model.Bid;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.RoundRecord;
import org.evalux.landlord.model.Seat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Calcule les statistiques d'un joueur à partir de son historique complet.
 *
 * Les manches doivent arriver dans l'ordre chronologique (plus ancienne d'abord),
 * les matchs dans l'ordre de début. Les séries et le cumul global en dépendent.
 *
 * Les enregistrements anciens ou incomplets ne font jamais échouer le calcul :
 * printemps absent = false, premier à annoncer absent = place 0, et une ligne
 * où le joueur n'a pas de place (ou un landlord hors bornes) est ignorée.
 */
@Slf4j
@Service
public class StatisticsEngine {

    /** Une manche avec la place qu'y occupait le joueur. */
    private record SeatedRound(RoundRecord round, Seat seat, Seat landlord) {
        long score() { return round.scoreOf(seat); }
        boolean isLandlord() { return seat == landlord; }
    }

    private record SeatedMatch(MatchSummary match, Seat seat) {
        long finalScore() { return match.finalScore().of(seat); }
    }

    public PlayerStatistics computeStatistics(Long playerId, List<RoundRecord> rounds, List<MatchSummary> matches) {
        return computeStatistics(playerId, null, rounds, matches);
    }

    public PlayerStatistics computeStatistics(Long playerId, String playerName,
                                              List<RoundRecord> rounds, List<MatchSummary> matches) {
        PlayerStatistics stats = new PlayerStatistics(playerId, playerName);

        List<SeatedRound> seated = seatRounds(playerId, rounds == null ? List.of() : rounds);
        List<SeatedMatch> seatedMatches = seatMatches(playerId, matches == null ? List.of() : matches);

        tallyTotals(stats, seated);
        tallyRoles(stats, seated);
        tallyFirstBids(stats, seated);
        tallySprings(stats, seated);
        tallyDoubled(stats, seated);
        roundStreaks(stats, seated);
        roundMilestones(stats, seated);
        runningMilestone(stats, seated);

        tallyMatches(stats, seatedMatches);
        matchStreaks(stats, seatedMatches);
        matchMilestones(stats, seatedMatches);

        return stats;
    }

    // ---------------------------------------------------------------- préparation

    private List<SeatedRound> seatRounds(Long playerId, List<RoundRecord> rounds) {
        List<SeatedRound> out = new ArrayList<>(rounds.size());
        for (RoundRecord r : rounds) {
            if (r == null) continue;
            Seat seat = r.seatOf(playerId);
            if (seat == null) {
                log.warn("Manche {} ignorée : joueur {} absent", r.getId(), playerId);
                continue;
            }
            if (r.getLandlord() < 1 || r.getLandlord() > 3) {
                log.warn("Manche {} ignorée : landlord invalide ({})", r.getId(), r.getLandlord());
                continue;
            }
            out.add(new SeatedRound(r, seat, r.landlordSeat()));
        }
        return out;
    }

    private List<SeatedMatch> seatMatches(Long playerId, List<MatchSummary> matches) {
        List<SeatedMatch> out = new ArrayList<>(matches.size());
        for (MatchSummary m : matches) {
            if (m == null) continue;
            Seat seat = m.seatOf(playerId);
            if (seat == null) {
                log.warn("Match {} ignoré : joueur {} absent", m.getId(), playerId);
                continue;
            }
            out.add(new SeatedMatch(m, seat));
        }
        return out;
    }

    // ---------------------------------------------------------------- manches

    private void tallyTotals(PlayerStatistics stats, List<SeatedRound> rounds) {
        stats.setTotalGames(rounds.size());
        int won = 0, lost = 0;
        long total = 0;
        for (SeatedRound sr : rounds) {
            long score = sr.score();
            if (score > 0) won++;
            else if (score < 0) lost++;
            total += score;
        }
        stats.setGamesWon(won);
        stats.setGamesLost(lost);
        stats.setTotalScore(total);
    }

    private void tallyRoles(PlayerStatistics stats, List<SeatedRound> rounds) {
        int asLandlord = 0, asFarmer = 0;
        int landlordWins = 0, landlordLosses = 0, farmerWins = 0, farmerLosses = 0;
        for (SeatedRound sr : rounds) {
            long score = sr.score();
            if (sr.isLandlord()) {
                asLandlord++;
                if (score > 0) landlordWins++;
                else if (score < 0) landlordLosses++;
            } else {
                asFarmer++;
                if (score > 0) farmerWins++;
                else if (score < 0) farmerLosses++;
            }
        }
        stats.setGamesAsLandlord(asLandlord);
        stats.setGamesAsFarmer(asFarmer);
        stats.setLandlordWins(landlordWins);
        stats.setLandlordLosses(landlordLosses);
        stats.setFarmerWins(farmerWins);
        stats.setFarmerLosses(farmerLosses);
    }

    private void tallyFirstBids(PlayerStatistics stats, List<SeatedRound> rounds) {
        int games = 0;
        int[] counts = new int[4];
        for (SeatedRound sr : rounds) {
            if (sr.round().firstBidderIndex() != sr.seat().index()) continue;
            games++;
            Bid bid = sr.round().bidOf(sr.seat());
            counts[bid.getPoints()]++;
        }
        stats.setFirstBidderGames(games);
        stats.setBidZeroCount(counts[0]);
        stats.setBidOneCount(counts[1]);
        stats.setBidTwoCount(counts[2]);
        stats.setBidThreeCount(counts[3]);
    }

    private void tallySprings(PlayerStatistics stats, List<SeatedRound> rounds) {
        int sprung = 0, sprungAgainst = 0;
        for (SeatedRound sr : rounds) {
            RoundRecord r = sr.round();
            if (!r.isSpringRound() || !r.isLandlordResult()) continue;
            if (sr.isLandlord()) sprung++;
            else sprungAgainst++;
        }
        stats.setSpringCount(sprung);
        stats.setSpringAgainstCount(sprungAgainst);
    }

    private void tallyDoubled(PlayerStatistics stats, List<SeatedRound> rounds) {
        int games = 0, wins = 0, losses = 0;
        for (SeatedRound sr : rounds) {
            if (!sr.round().doubledOf(sr.seat())) continue;
            games++;
            long score = sr.score();
            if (score > 0) wins++;
            else if (score < 0) losses++;
        }
        stats.setDoubledGames(games);
        stats.setDoubledWins(wins);
        stats.setDoubledLosses(losses);
    }

    private void roundStreaks(PlayerStatistics stats, List<SeatedRound> rounds) {
        StreakCounter streak = new StreakCounter();
        for (SeatedRound sr : rounds) {
            streak.accept(sr.score());
        }
        stats.setMaxWinStreak(streak.maxWin);
        stats.setMaxLossStreak(streak.maxLoss);
        stats.setCurrentWinStreak(streak.win);
        stats.setCurrentLossStreak(streak.loss);
    }

    private void roundMilestones(PlayerStatistics stats, List<SeatedRound> rounds) {
        if (rounds.isEmpty()) return;
        long best = Long.MIN_VALUE, worst = Long.MAX_VALUE;
        for (SeatedRound sr : rounds) {
            best = Math.max(best, sr.score());
            worst = Math.min(worst, sr.score());
        }
        stats.setBestGameScore(best);
        stats.setWorstGameScore(worst);
    }

    private void runningMilestone(PlayerStatistics stats, List<SeatedRound> rounds) {
        long running = 0;
        for (int i = 0; i < rounds.size(); i++) {
            running += rounds.get(i).score();
            if (i == 0 || running > stats.getGlobalPeakScore()) {
                stats.setGlobalPeakScore(running);
                stats.setGlobalPeakIndex(i);
            }
            if (i == 0 || running < stats.getGlobalTroughScore()) {
                stats.setGlobalTroughScore(running);
                stats.setGlobalTroughIndex(i);
            }
        }
    }

    // ---------------------------------------------------------------- matchs

    private void tallyMatches(PlayerStatistics stats, List<SeatedMatch> matches) {
        int won = 0, lost = 0, tied = 0;
        for (SeatedMatch sm : matches) {
            long score = sm.finalScore();
            if (score > 0) won++;
            else if (score < 0) lost++;
            else tied++;
        }
        stats.setTotalMatches(matches.size());
        stats.setMatchesWon(won);
        stats.setMatchesLost(lost);
        stats.setMatchesTied(tied);
    }

    private void matchStreaks(PlayerStatistics stats, List<SeatedMatch> matches) {
        StreakCounter streak = new StreakCounter();
        for (SeatedMatch sm : matches) {
            streak.accept(sm.finalScore());
        }
        stats.setMaxMatchWinStreak(streak.maxWin);
        stats.setMaxMatchLossStreak(streak.maxLoss);
        stats.setCurrentMatchWinStreak(streak.win);
        stats.setCurrentMatchLossStreak(streak.loss);
    }

    private void matchMilestones(PlayerStatistics stats, List<SeatedMatch> matches) {
        if (matches.isEmpty()) return;
        long bestFinal = Long.MIN_VALUE, worstFinal = Long.MAX_VALUE;
        long bestSnap = Long.MIN_VALUE, worstSnap = Long.MAX_VALUE;
        for (SeatedMatch sm : matches) {
            long fin = sm.finalScore();
            bestFinal = Math.max(bestFinal, fin);
            worstFinal = Math.min(worstFinal, fin);
            bestSnap = Math.max(bestSnap, sm.match().maxSnapshot().of(sm.seat()));
            worstSnap = Math.min(worstSnap, sm.match().minSnapshot().of(sm.seat()));
        }
        stats.setBestMatchScore(bestFinal);
        stats.setWorstMatchScore(worstFinal);
        stats.setBestSnapshot(bestSnap);
        stats.setWorstSnapshot(worstSnap);
    }

    /**
     * Séries de victoires / défaites. Un résultat nul (delta 0) remet les deux compteurs à zéro.
     */
    static final class StreakCounter {
        int win, loss, maxWin, maxLoss;

        void accept(long delta) {
            if (delta > 0) {
                win++;
                loss = 0;
                maxWin = Math.max(maxWin, win);
            } else if (delta < 0) {
                loss++;
                win = 0;
                maxLoss = Math.max(maxLoss, loss);
            } else {
                win = 0;
                loss = 0;
            }
        }
    }
}
