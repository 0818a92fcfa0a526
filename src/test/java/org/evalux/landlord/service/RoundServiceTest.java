package org.evalux.landlord.service;

import org.evalux.landlord.model.Bid;
import org.evalux.landlord.model.MatchSession;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.RoundInput;
import org.evalux.landlord.model.RoundRecord;
import org.evalux.landlord.model.ScoreTriple;
import org.evalux.landlord.model.rules.ValidationError;
import org.evalux.landlord.repo.RoundRecordRepository;
import org.evalux.landlord.service.engine.MatchAggregator.MatchFold;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoundServiceTest {

    @Mock
    private RoundRecordRepository rounds;

    @Mock
    private MatchService matchService;

    @InjectMocks
    private RoundService roundService;

    private MatchSummary match(int starter, boolean finished) {
        return MatchSummary.builder()
                .id(7L)
                .startedAt(LocalDateTime.of(2024, 3, 1, 20, 0))
                .endedAt(finished ? LocalDateTime.of(2024, 3, 1, 23, 0) : null)
                .playerAId(1L).playerAName("Alice")
                .playerBId(2L).playerBName("Bruno")
                .playerCId(3L).playerCName("Chloé")
                .initialStarter(starter)
                .build();
    }

    private RoundRecord stored(int index, Integer firstBidder) {
        return RoundRecord.builder()
                .id(100L + index)
                .matchId(7L)
                .gameIndex(index)
                .playerAId(1L).playerBId(2L).playerCId(3L)
                .landlord(1)
                .bidA(Bid.ONE).bidB(Bid.NONE).bidC(Bid.NONE)
                .landlordResult(true)
                .scoreA(200).scoreB(-100).scoreC(-100)
                .firstBidder(firstBidder)
                .build();
    }

    private static RoundInput input(Bid a, Bid b, Bid c, boolean landlordWins) {
        return new RoundInput(a, b, c, false, false, false, 0, false, landlordWins);
    }

    private MatchFold fold(MatchSummary summary) {
        return new MatchFold(List.of(), ScoreTriple.ZERO, 0, ScoreTriple.ZERO, ScoreTriple.ZERO, summary);
    }

    // --- resolve() ---

    @Test
    void resolve_shouldComputeDeltasForUniqueBidder() {
        RoundService.ResolvedRound r = roundService.resolve(input(Bid.NONE, Bid.THREE, Bid.ONE, false));

        assertThat(r.resolution().baseStake()).isEqualTo(300);
        assertThat(r.deltas()).isEqualTo(new ScoreTriple(300, -600, 300));
    }

    @Test
    void resolve_shouldThrowAmbiguousBid_whenTopLevelIsShared() {
        assertThatThrownBy(() -> roundService.resolve(input(Bid.TWO, Bid.TWO, Bid.NONE, true)))
                .isInstanceOf(BidValidationException.class)
                .satisfies(e -> {
                    ValidationError err = ((BidValidationException) e).getError();
                    assertThat(err.kind()).isEqualTo(ValidationError.Kind.AMBIGUOUS_BID);
                    assertThat(err.level()).isEqualTo(2);
                });
    }

    // --- record() ---

    @Test
    void record_shouldAppendRoundWithRotationAndRecompute() {
        MatchSummary m = match(1, false);
        when(matchService.session(7L)).thenReturn(new MatchSession(m, List.of(stored(0, 1), stored(1, 2))));
        when(rounds.save(any(RoundRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RoundRecord saved = roundService.record(7L, input(Bid.ONE, Bid.NONE, Bid.NONE, true));

        ArgumentCaptor<RoundRecord> captor = ArgumentCaptor.forClass(RoundRecord.class);
        InOrder order = inOrder(rounds, matchService);
        order.verify(rounds).save(captor.capture());
        order.verify(matchService).recompute(7L);

        RoundRecord r = captor.getValue();
        assertThat(r).isSameAs(saved);
        assertThat(r.getMatchId()).isEqualTo(7L);
        assertThat(r.getGameIndex()).isEqualTo(2);
        // (2 + 1) % 3
        assertThat(r.getFirstBidder()).isEqualTo(0);
        assertThat(r.getLandlord()).isEqualTo(1);
        assertThat(r.getPlayerBName()).isEqualTo("Bruno");
        assertThat(r.getScoreA()).isEqualTo(200);
        assertThat(r.getScoreB()).isEqualTo(-100);
        assertThat(r.getScoreC()).isEqualTo(-100);
        assertThat(r.isSpringRound()).isFalse();
    }

    @Test
    void record_withoutAnyBid_shouldRejectAndSaveNothing() {
        when(matchService.session(7L)).thenReturn(new MatchSession(match(0, false), List.of()));

        assertThatThrownBy(() -> roundService.record(7L, input(Bid.NONE, Bid.NONE, Bid.NONE, true)))
                .isInstanceOf(BidValidationException.class)
                .extracting(e -> ((BidValidationException) e).getError().kind())
                .isEqualTo(ValidationError.Kind.NO_BID);

        verify(rounds, never()).save(any());
        verify(matchService, never()).recompute(anyLong());
    }

    @Test
    void record_onFinishedMatch_shouldThrowIllegalState() {
        when(matchService.session(7L)).thenReturn(new MatchSession(match(0, true), List.of(stored(0, 0))));

        assertThatThrownBy(() -> roundService.record(7L, input(Bid.ONE, Bid.NONE, Bid.NONE, true)))
                .isInstanceOf(IllegalStateException.class);

        verifyNoInteractions(rounds);
    }

    // --- edit() ---

    @Test
    void edit_shouldKeepStoredFirstBidderAndRecompute() {
        MatchSummary m = match(0, true);
        RoundRecord existing = stored(1, 2);
        when(matchService.get(7L)).thenReturn(m);
        when(rounds.findByMatchIdAndGameIndex(7L, 1)).thenReturn(Optional.of(existing));
        when(rounds.save(existing)).thenReturn(existing);
        when(matchService.recompute(7L)).thenReturn(fold(m));

        roundService.edit(7L, 1, input(Bid.NONE, Bid.NONE, Bid.TWO, false));

        // la formule donnerait 1, la valeur enregistrée l'emporte
        assertThat(existing.getFirstBidder()).isEqualTo(2);
        assertThat(existing.getLandlord()).isEqualTo(3);
        assertThat(existing.getBidC()).isEqualTo(Bid.TWO);
        assertThat(existing.isLandlordResult()).isFalse();
        assertThat(existing.getScoreA()).isEqualTo(200);
        assertThat(existing.getScoreB()).isEqualTo(200);
        assertThat(existing.getScoreC()).isEqualTo(-400);
        verify(matchService).recompute(7L);
    }

    @Test
    void edit_legacyRoundWithoutFirstBidder_shouldFillItFromRotation() {
        MatchSummary m = match(1, false);
        RoundRecord existing = stored(1, null);
        when(matchService.get(7L)).thenReturn(m);
        when(rounds.findByMatchIdAndGameIndex(7L, 1)).thenReturn(Optional.of(existing));
        when(rounds.save(existing)).thenReturn(existing);
        when(matchService.recompute(7L)).thenReturn(fold(m));

        roundService.edit(7L, 1, input(Bid.ONE, Bid.NONE, Bid.NONE, true));

        assertThat(existing.getFirstBidder()).isEqualTo(2);
    }

    @Test
    void edit_unknownRound_shouldThrowNotFound() {
        when(matchService.get(7L)).thenReturn(match(0, false));
        when(rounds.findByMatchIdAndGameIndex(7L, 9)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> roundService.edit(7L, 9, input(Bid.ONE, Bid.NONE, Bid.NONE, true)))
                .isInstanceOf(NoSuchElementException.class);

        verify(rounds, never()).save(any());
    }

    // --- delete() ---

    @Test
    void delete_shouldShiftLaterRoundsAndRecompute() {
        RoundRecord r0 = stored(0, 0);
        RoundRecord r1 = stored(1, 1);
        RoundRecord r2 = stored(2, 2);
        when(matchService.session(7L)).thenReturn(new MatchSession(match(0, false), List.of(r0, r1, r2)));
        when(rounds.findByMatchIdAndGameIndex(7L, 1)).thenReturn(Optional.of(r1));

        roundService.delete(7L, 1);

        verify(rounds).delete(r1);
        verify(rounds).saveAll(List.of(r2));
        verify(rounds).flush();
        verify(matchService).recompute(7L);
        assertThat(r0.getGameIndex()).isZero();
        assertThat(r2.getGameIndex()).isEqualTo(1);
        // le premier à annoncer reste attaché à la manche
        assertThat(r2.getFirstBidder()).isEqualTo(2);
    }

    @Test
    void delete_lastRoundOfFinishedMatch_shouldDeleteMatch() {
        RoundRecord only = stored(0, 0);
        when(matchService.session(7L)).thenReturn(new MatchSession(match(0, true), List.of(only)));
        when(rounds.findByMatchIdAndGameIndex(7L, 0)).thenReturn(Optional.of(only));

        roundService.delete(7L, 0);

        verify(rounds).delete(only);
        verify(matchService).delete(7L);
        verify(matchService, never()).recompute(anyLong());
    }

    @Test
    void delete_lastRoundOfMatchInProgress_shouldKeepMatch() {
        RoundRecord only = stored(0, 0);
        when(matchService.session(7L)).thenReturn(new MatchSession(match(0, false), List.of(only)));
        when(rounds.findByMatchIdAndGameIndex(7L, 0)).thenReturn(Optional.of(only));

        roundService.delete(7L, 0);

        verify(matchService, never()).delete(anyLong());
        verify(matchService).recompute(7L);
    }

    // --- forMatch() ---

    @Test
    void forMatch_shouldReturnRoundsInOrder() {
        List<RoundRecord> list = List.of(stored(0, 0), stored(1, 1));
        when(matchService.get(7L)).thenReturn(match(0, false));
        when(rounds.findByMatchIdOrderByGameIndexAsc(7L)).thenReturn(list);

        assertThat(roundService.forMatch(7L)).isSameAs(list);
    }
}
