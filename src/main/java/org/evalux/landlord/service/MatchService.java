package org.evalux.landlord.service;

import lombok.extern.slf4j.Slf4j;
import org.evalux.landlord.dto.MatchView;
import org.evalux.landlord.model.MatchSession;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.Player;
import org.evalux.landlord.model.RoundRecord;
import org.evalux.landlord.model.Seat;
import org.evalux.landlord.model.rules.FirstBidderRotation;
import org.evalux.landlord.repo.MatchSummaryRepository;
import org.evalux.landlord.repo.RoundRecordRepository;
import org.evalux.landlord.service.engine.MatchAggregator;
import org.evalux.landlord.service.engine.MatchAggregator.MatchFold;
import org.evalux.landlord.service.stats.PlayerStatistics;
import org.evalux.landlord.service.stats.StatisticsEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Cycle de vie d'un match : démarrage, recalcul complet, fin, suppression.
 * Le résumé persisté n'est jamais corrigé par différence : chaque changement
 * de manche repasse par MatchAggregator depuis la première manche.
 */
@Slf4j
@Service
public class MatchService {

    private final MatchSummaryRepository matches;
    private final RoundRecordRepository rounds;
    private final PlayerService players;
    private final MatchAggregator aggregator;
    private final StatisticsEngine statisticsEngine;
    private final int defaultStarter;
    private final int defaultLimit;

    public MatchService(MatchSummaryRepository matches,
                        RoundRecordRepository rounds,
                        PlayerService players,
                        MatchAggregator aggregator,
                        StatisticsEngine statisticsEngine,
                        @Value("${app.match.default-starter:0}") int defaultStarter,
                        @Value("${app.history.default-limit:20}") int defaultLimit) {
        this.matches = matches;
        this.rounds = rounds;
        this.players = players;
        this.aggregator = aggregator;
        this.statisticsEngine = statisticsEngine;
        this.defaultStarter = Math.floorMod(defaultStarter, 3);
        this.defaultLimit = Math.max(1, defaultLimit);
    }

    @Transactional
    public MatchSummary start(Long playerAId, Long playerBId, Long playerCId, Integer initialStarter) {
        if (playerAId == null || playerBId == null || playerCId == null) {
            throw new IllegalArgumentException("Trois joueurs requis");
        }
        if (new HashSet<>(List.of(playerAId, playerBId, playerCId)).size() != 3) {
            throw new IllegalArgumentException("Les trois joueurs doivent être différents");
        }
        int starter = initialStarter != null ? initialStarter : defaultStarter;
        if (starter < 0 || starter > 2) throw new IllegalArgumentException("Joueur de départ invalide (0..2)");

        Player a = players.get(playerAId);
        Player b = players.get(playerBId);
        Player c = players.get(playerCId);

        if (!matches.findInProgressInvolving(List.of(playerAId, playerBId, playerCId)).isEmpty()) {
            throw new IllegalStateException("Un des joueurs a déjà un match en cours");
        }

        MatchSummary m = MatchSummary.builder()
                .startedAt(LocalDateTime.now())
                .playerAId(a.getId()).playerAName(a.getName())
                .playerBId(b.getId()).playerBName(b.getName())
                .playerCId(c.getId()).playerCName(c.getName())
                .initialStarter(starter)
                .build();
        MatchSummary saved = matches.save(m);
        log.info("Match {} démarré ({} / {} / {}), départ place {}", saved.getId(), a.getName(), b.getName(), c.getName(), starter);
        return saved;
    }

    public MatchSummary get(Long matchId) {
        return matches.findById(matchId)
                .orElseThrow(() -> new NoSuchElementException("Match inconnu: " + matchId));
    }

    /** Photo du match telle qu'elle est en base. */
    public MatchSession session(Long matchId) {
        MatchSummary summary = get(matchId);
        List<RoundRecord> list = rounds.findByMatchIdOrderByGameIndexAsc(matchId);
        return new MatchSession(summary, list);
    }

    /** Le match avec ses manches, le cumul après chacune d'elles et les statistiques de chaque place. */
    @Transactional(readOnly = true)
    public MatchView view(Long matchId) {
        MatchSession session = session(matchId);
        return MatchView.of(session, aggregator.foldMatch(session.rounds()), seatStatistics(session));
    }

    /** Statistiques de chacune des trois places, limitées aux manches de ce match. */
    @Transactional(readOnly = true)
    public List<PlayerStatistics> statistics(Long matchId) {
        return seatStatistics(session(matchId));
    }

    private List<PlayerStatistics> seatStatistics(MatchSession session) {
        MatchSummary m = session.summary();
        List<PlayerStatistics> out = new ArrayList<>(3);
        for (Seat seat : Seat.values()) {
            Long playerId = m.playerIdOf(seat);
            out.add(statisticsEngine.computeStatistics(playerId, m.playerNameOf(seat), session.rounds(), List.of()));
        }
        return out;
    }

    /**
     * Recalcule tout le match depuis ses manches et sauvegarde le résumé.
     * À appeler après chaque ajout, modification ou suppression de manche.
     */
    @Transactional
    public MatchFold recompute(Long matchId) {
        MatchSession session = session(matchId);
        MatchFold fold = aggregator.foldMatch(session);
        matches.save(fold.summary());
        log.debug("Match {} recalculé : {} manche(s), score {}", matchId, fold.totalGames(), fold.finalScore());
        return fold;
    }

    /**
     * Termine le match. Un match sans aucune manche est supprimé au lieu d'être conservé.
     *
     * @return le résumé final, vide si le match a été abandonné
     */
    @Transactional
    public Optional<MatchSummary> end(Long matchId) {
        MatchSession session = session(matchId);
        if (session.summary().isFinished()) {
            throw new IllegalStateException("Match déjà terminé");
        }
        if (session.roundCount() == 0) {
            matches.delete(session.summary());
            log.info("Match {} vide, abandonné", matchId);
            return Optional.empty();
        }
        MatchFold fold = aggregator.finalizeMatch(session, LocalDateTime.now());
        MatchSummary saved = matches.save(fold.summary());
        log.info("Match {} terminé après {} manche(s) : {}", matchId, fold.totalGames(), fold.finalScore());
        return Optional.of(saved);
    }

    @Transactional
    public void delete(Long matchId) {
        MatchSummary m = get(matchId);
        int removed = rounds.deleteByMatchId(matchId);
        matches.delete(m);
        log.info("Match {} supprimé avec {} manche(s)", matchId, removed);
    }

    /** Place qui annonce en premier à la prochaine manche. */
    public int nextBidder(Long matchId) {
        MatchSession session = session(matchId);
        if (session.summary().isFinished()) throw new IllegalStateException("Match terminé");
        return FirstBidderRotation.nextBidder(session);
    }

    public List<MatchSummary> recent(Integer limit) {
        return matches.findAllByOrderByStartedAtDesc(PageRequest.of(0, clamp(limit)));
    }

    public List<MatchSummary> recentForPlayer(Long playerId, Integer limit) {
        players.get(playerId);
        return matches.findForPlayerRecentFirst(playerId, PageRequest.of(0, clamp(limit)));
    }

    private int clamp(Integer limit) {
        if (limit == null || limit <= 0) return defaultLimit;
        return Math.min(limit, 200);
    }
}
