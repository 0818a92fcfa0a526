package org.evalux.landlord.model.rules;

import org.evalux.landlord.model.Bid;
import org.evalux.landlord.model.RoundInput;
import org.evalux.landlord.model.Seat;
import org.evalux.landlord.model.rules.BidResolver.BidResolution;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.evalux.landlord.model.Bid.*;

class BidResolverTest {

    @Test
    void resolveBids_singleHighestBidder_becomesLandlord() {
        BidResolution r = BidResolver.resolveBids(NONE, TWO, ONE);

        assertThat(r.isValid()).isTrue();
        assertThat(r.landlord()).isEqualTo(Seat.B);
        assertThat(r.baseStake()).isEqualTo(200);
    }

    @Test
    void resolveBids_threeBeatsTieAtLowerLevel() {
        BidResolution r = BidResolver.resolveBids(THREE, TWO, TWO);

        assertThat(r.isValid()).isTrue();
        assertThat(r.landlord()).isEqualTo(Seat.A);
        assertThat(r.baseStake()).isEqualTo(300);
    }

    @Test
    void resolveBids_tieAtHighestLevel_isAmbiguous() {
        BidResolution r = BidResolver.resolveBids(TWO, TWO, NONE);

        assertThat(r.isValid()).isFalse();
        assertThat(r.landlord()).isNull();
        assertThat(r.error().kind()).isEqualTo(ValidationError.Kind.AMBIGUOUS_BID);
        assertThat(r.error().level()).isEqualTo(2);
        assertThat(r.error().message()).isNotBlank();
    }

    @Test
    void resolveBids_everyoneBidsOne_isAmbiguousAtOne() {
        BidResolution r = BidResolver.resolveBids(ONE, ONE, ONE);

        assertThat(r.error().kind()).isEqualTo(ValidationError.Kind.AMBIGUOUS_BID);
        assertThat(r.error().level()).isEqualTo(1);
    }

    @Test
    void resolveBids_nobodyBids_isNoBid() {
        BidResolution r = BidResolver.resolveBids(NONE, NONE, NONE);

        assertThat(r.isValid()).isFalse();
        assertThat(r.error().kind()).isEqualTo(ValidationError.Kind.NO_BID);
        assertThat(r.error().level()).isNull();
    }

    @Test
    void resolveBids_nullBidsCountAsNone() {
        BidResolution r = BidResolver.resolveBids(null, null, ONE);

        assertThat(r.landlord()).isEqualTo(Seat.C);
        assertThat(r.baseStake()).isEqualTo(100);
    }

    @Test
    void resolveBids_fromRoundInput_isDeterministic() {
        RoundInput in = new RoundInput(ONE, THREE, TWO, false, false, false, 0, false, true);

        BidResolution first = BidResolver.resolveBids(in);
        BidResolution second = BidResolver.resolveBids(in);

        assertThat(first).isEqualTo(second);
        assertThat(first.landlord()).isEqualTo(Seat.B);
        assertThat(first.baseStake()).isEqualTo(300);
    }

    @Test
    void bidFromPoints_mapsZeroToNone() {
        assertThat(Bid.fromPoints(0)).isEqualTo(NONE);
        assertThat(Bid.fromPoints(3)).isEqualTo(THREE);
    }
}
