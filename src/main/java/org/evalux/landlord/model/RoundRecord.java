package org.evalux.landlord.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Résultat résolu et persisté d'une manche.
 * Les deltas scoreA + scoreB + scoreC valent toujours 0.
 */
@Entity
@Table(name = "round_record",
        indexes = {
                @Index(name = "rr_match_idx", columnList = "match_id, game_index"),
                @Index(name = "rr_player_a_idx", columnList = "player_a_id"),
                @Index(name = "rr_player_b_idx", columnList = "player_b_id"),
                @Index(name = "rr_player_c_idx", columnList = "player_c_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "match_id", nullable = false)
    private Long matchId;

    // ordre dans le match (0-based)
    @Column(name = "game_index", nullable = false)
    private int gameIndex;

    @Column(nullable = false)
    private LocalDateTime playedAt;

    @Column(name = "player_a_id", nullable = false)
    private Long playerAId;
    @Column(name = "player_b_id", nullable = false)
    private Long playerBId;
    @Column(name = "player_c_id", nullable = false)
    private Long playerCId;

    // dénormalisés pour l'affichage
    private String playerAName;
    private String playerBName;
    private String playerCName;

    // 1=A, 2=B, 3=C
    @Column(nullable = false)
    private int landlord;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Bid bidA;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Bid bidB;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Bid bidC;

    private boolean doubledA;
    private boolean doubledB;
    private boolean doubledC;

    @Column(nullable = false)
    private int bombs;

    // null sur les anciens enregistrements
    private Boolean spring;

    @Column(nullable = false)
    private boolean landlordResult;

    @Column(nullable = false)
    private long scoreA;
    @Column(nullable = false)
    private long scoreB;
    @Column(nullable = false)
    private long scoreC;

    // 0=A, 1=B, 2=C ; null sur les anciens enregistrements
    private Integer firstBidder;

    @PrePersist
    public void prePersist() {
        if (playedAt == null) playedAt = LocalDateTime.now();
    }

    public boolean isSpringRound() {
        return spring != null && spring;
    }

    public int firstBidderIndex() {
        return firstBidder != null ? firstBidder : 0;
    }

    public Seat landlordSeat() {
        return Seat.fromPosition(landlord);
    }

    public ScoreTriple deltas() {
        return new ScoreTriple(scoreA, scoreB, scoreC);
    }

    public long scoreOf(Seat seat) {
        return deltas().of(seat);
    }

    public RoundOutcome outcomeOf(Seat seat) {
        return RoundOutcome.of(scoreOf(seat));
    }

    public boolean doubledOf(Seat seat) {
        return switch (seat) {
            case A -> doubledA;
            case B -> doubledB;
            case C -> doubledC;
        };
    }

    public Bid bidOf(Seat seat) {
        Bid bid = switch (seat) {
            case A -> bidA;
            case B -> bidB;
            case C -> bidC;
        };
        return bid != null ? bid : Bid.NONE;
    }

    public Long playerIdOf(Seat seat) {
        return switch (seat) {
            case A -> playerAId;
            case B -> playerBId;
            case C -> playerCId;
        };
    }

    /** Place occupée par ce joueur dans la manche, ou null s'il n'y était pas. */
    public Seat seatOf(Long playerId) {
        if (playerId == null) return null;
        for (Seat s : Seat.values()) {
            if (Objects.equals(playerIdOf(s), playerId)) return s;
        }
        return null;
    }
}
