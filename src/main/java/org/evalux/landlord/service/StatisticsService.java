package org.evalux.landlord.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.Player;
import org.evalux.landlord.model.RoundRecord;
import org.evalux.landlord.repo.MatchSummaryRepository;
import org.evalux.landlord.repo.RoundRecordRepository;
import org.evalux.landlord.service.stats.PlayerStatistics;
import org.evalux.landlord.service.stats.StatisticsEngine;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Charge l'historique d'un joueur et le rejoue entièrement.
 * Rien n'est mis en cache : une correction de manche est visible dès l'appel suivant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsService {
    private final PlayerService players;
    private final RoundRecordRepository rounds;
    private final MatchSummaryRepository matches;
    private final StatisticsEngine engine;

    @Transactional(readOnly = true)
    public PlayerStatistics forPlayer(Long playerId) {
        Player p = players.get(playerId);
        List<RoundRecord> history = rounds.findForPlayerChronological(playerId);
        List<MatchSummary> finished = matches.findFinishedForPlayerChronological(playerId);
        log.debug("Statistiques de {} : {} manche(s), {} match(s)", p.getName(), history.size(), finished.size());
        return engine.computeStatistics(p.getId(), p.getName(), history, finished);
    }
}
