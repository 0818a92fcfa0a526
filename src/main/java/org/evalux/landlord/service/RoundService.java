package org.evalux.landlord.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.landlord.model.MatchSession;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.RoundInput;
import org.evalux.landlord.model.RoundRecord;
import org.evalux.landlord.model.ScoreTriple;
import org.evalux.landlord.model.rules.BidResolver;
import org.evalux.landlord.model.rules.BidResolver.BidResolution;
import org.evalux.landlord.model.rules.FirstBidderRotation;
import org.evalux.landlord.model.rules.MultiplierEngine;
import org.evalux.landlord.model.rules.MultiplierEngine.RoundModifiers;
import org.evalux.landlord.repo.RoundRecordRepository;
import org.evalux.landlord.service.engine.MatchAggregator.MatchFold;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Saisie, correction et suppression des manches d'un match.
 * Chaque écriture est suivie d'un recalcul complet du match.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundService {
    private final RoundRecordRepository rounds;
    private final MatchService matchService;

    /**
     * Résout les annonces puis calcule les points d'une manche.
     *
     * @throws BidValidationException si les annonces sont ambiguës ou absentes
     */
    public ResolvedRound resolve(RoundInput input) {
        BidResolution resolution = BidResolver.resolveBids(input);
        if (!resolution.isValid()) throw new BidValidationException(resolution.error());
        ScoreTriple deltas = MultiplierEngine.applyMultipliers(
                resolution.baseStake(),
                RoundModifiers.from(input, resolution.landlord()));
        return new ResolvedRound(resolution, deltas);
    }

    public record ResolvedRound(BidResolution resolution, ScoreTriple deltas) {}

    @Transactional
    public RoundRecord record(Long matchId, RoundInput input) {
        MatchSession session = matchService.session(matchId);
        MatchSummary match = session.summary();
        if (match.isFinished()) throw new IllegalStateException("Match terminé : utiliser la correction de manche");

        ResolvedRound resolved = resolve(input);
        int index = session.roundCount();

        RoundRecord r = RoundRecord.builder()
                .matchId(matchId)
                .gameIndex(index)
                .playerAId(match.getPlayerAId()).playerAName(match.getPlayerAName())
                .playerBId(match.getPlayerBId()).playerBName(match.getPlayerBName())
                .playerCId(match.getPlayerCId()).playerCName(match.getPlayerCName())
                .firstBidder(FirstBidderRotation.firstBidder(index, match.getInitialStarter()))
                .build();
        applyInput(r, input, resolved);
        RoundRecord saved = rounds.save(r);

        matchService.recompute(matchId);
        log.info("Manche {} du match {} enregistrée : landlord {}, points {}",
                index, matchId, resolved.resolution().landlord(), resolved.deltas());
        return saved;
    }

    /**
     * Corrige une manche existante. Le premier à annoncer enregistré est conservé ;
     * la formule de rotation ne sert que si l'enregistrement n'en a pas.
     */
    @Transactional
    public RoundRecord edit(Long matchId, int gameIndex, RoundInput input) {
        MatchSummary match = matchService.get(matchId);
        RoundRecord r = find(matchId, gameIndex);

        ResolvedRound resolved = resolve(input);
        applyInput(r, input, resolved);
        r.setFirstBidder(FirstBidderRotation.effectiveFirstBidder(
                r.getFirstBidder(), gameIndex, match.getInitialStarter()));
        RoundRecord saved = rounds.save(r);

        MatchFold fold = matchService.recompute(matchId);
        log.info("Manche {} du match {} corrigée, nouveau score {}", gameIndex, matchId, fold.finalScore());
        return saved;
    }

    /** Supprime une manche et renumérote les suivantes. */
    @Transactional
    public void delete(Long matchId, int gameIndex) {
        MatchSession session = matchService.session(matchId);
        RoundRecord target = find(matchId, gameIndex);
        rounds.delete(target);

        List<RoundRecord> later = session.rounds().stream()
                .filter(r -> r.getGameIndex() > gameIndex)
                .toList();
        for (RoundRecord r : later) {
            r.setGameIndex(r.getGameIndex() - 1);
        }
        rounds.saveAll(later);
        rounds.flush();

        if (session.summary().isFinished() && session.roundCount() == 1) {
            // le match terminé n'a plus de manche : on ne garde pas de match vide
            matchService.delete(matchId);
            return;
        }
        matchService.recompute(matchId);
        log.info("Manche {} du match {} supprimée", gameIndex, matchId);
    }

    public List<RoundRecord> forMatch(Long matchId) {
        matchService.get(matchId);
        return rounds.findByMatchIdOrderByGameIndexAsc(matchId);
    }

    private RoundRecord find(Long matchId, int gameIndex) {
        return rounds.findByMatchIdAndGameIndex(matchId, gameIndex)
                .orElseThrow(() -> new NoSuchElementException("Manche inconnue: " + matchId + "/" + gameIndex));
    }

    private static void applyInput(RoundRecord r, RoundInput input, ResolvedRound resolved) {
        ScoreTriple d = resolved.deltas();
        r.setLandlord(resolved.resolution().landlord().position());
        r.setBidA(input.bidA());
        r.setBidB(input.bidB());
        r.setBidC(input.bidC());
        r.setDoubledA(input.doubledA());
        r.setDoubledB(input.doubledB());
        r.setDoubledC(input.doubledC());
        r.setBombs(input.bombs());
        r.setSpring(input.spring());
        r.setLandlordResult(input.landlordWins());
        r.setScoreA(d.a());
        r.setScoreB(d.b());
        r.setScoreC(d.c());
    }
}
