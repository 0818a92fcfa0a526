package org.evalux.landlord.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Agrégat d'un match (suite de manches entre les trois mêmes places).
 * Tant que endedAt est null, le match est en cours et les champs reflètent l'état courant.
 */
@Entity
@Table(name = "match_summary",
        indexes = {
                @Index(name = "ms_started_idx", columnList = "started_at"),
                @Index(name = "ms_player_a_idx", columnList = "player_a_id"),
                @Index(name = "ms_player_b_idx", columnList = "player_b_id"),
                @Index(name = "ms_player_c_idx", columnList = "player_c_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchSummary {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    private LocalDateTime endedAt;

    @Column(name = "player_a_id", nullable = false)
    private Long playerAId;
    @Column(name = "player_b_id", nullable = false)
    private Long playerBId;
    @Column(name = "player_c_id", nullable = false)
    private Long playerCId;

    private String playerAName;
    private String playerBName;
    private String playerCName;

    private long finalScoreA;
    private long finalScoreB;
    private long finalScoreC;

    private int totalGames;

    // plus haut / plus bas cumul atteint pendant le match
    private long maxSnapshotA;
    private long maxSnapshotB;
    private long maxSnapshotC;
    private long minSnapshotA;
    private long minSnapshotB;
    private long minSnapshotC;

    // place (0..2) qui annonce en premier à la manche 1
    @Column(nullable = false)
    private int initialStarter;

    @PrePersist
    public void prePersist() {
        if (startedAt == null) startedAt = LocalDateTime.now();
    }

    public boolean isFinished() {
        return endedAt != null;
    }

    public ScoreTriple finalScore() {
        return new ScoreTriple(finalScoreA, finalScoreB, finalScoreC);
    }

    public ScoreTriple maxSnapshot() {
        return new ScoreTriple(maxSnapshotA, maxSnapshotB, maxSnapshotC);
    }

    public ScoreTriple minSnapshot() {
        return new ScoreTriple(minSnapshotA, minSnapshotB, minSnapshotC);
    }

    public Long playerIdOf(Seat seat) {
        return switch (seat) {
            case A -> playerAId;
            case B -> playerBId;
            case C -> playerCId;
        };
    }

    public String playerNameOf(Seat seat) {
        return switch (seat) {
            case A -> playerAName;
            case B -> playerBName;
            case C -> playerCName;
        };
    }

    public Seat seatOf(Long playerId) {
        if (playerId == null) return null;
        for (Seat s : Seat.values()) {
            if (Objects.equals(playerIdOf(s), playerId)) return s;
        }
        return null;
    }

    /** Recopie le résultat d'un repli complet du match. */
    public void applyFold(ScoreTriple finalScore, int totalGames, ScoreTriple max, ScoreTriple min) {
        this.finalScoreA = finalScore.a();
        this.finalScoreB = finalScore.b();
        this.finalScoreC = finalScore.c();
        this.totalGames = totalGames;
        this.maxSnapshotA = max.a();
        this.maxSnapshotB = max.b();
        this.maxSnapshotC = max.c();
        this.minSnapshotA = min.a();
        this.minSnapshotB = min.b();
        this.minSnapshotC = min.c();
    }
}
