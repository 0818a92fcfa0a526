package org.evalux.landlord.service.stats;

import lombok.Getter;
import lombok.Setter;

/**
 * Statistiques d'un joueur, recalculées à chaque demande depuis tout son historique.
 * Jamais persistées.
 */
@Getter
@Setter
public class PlayerStatistics {
    private Long playerId;
    private String playerName;

    // Manches
    private int totalGames;
    private int gamesWon;
    private int gamesLost;
    private long totalScore;

    // Rôles
    private int gamesAsLandlord;
    private int gamesAsFarmer;
    private int landlordWins;
    private int landlordLosses;
    private int farmerWins;
    private int farmerLosses;

    // Annonces quand le joueur parlait en premier
    private int firstBidderGames;
    private int bidZeroCount;
    private int bidOneCount;
    private int bidTwoCount;
    private int bidThreeCount;

    // Printemps
    private int springCount;
    private int springAgainstCount;

    // Doublements
    private int doubledGames;
    private int doubledWins;
    private int doubledLosses;

    // Séries (manches)
    private int maxWinStreak;
    private int maxLossStreak;
    private int currentWinStreak;
    private int currentLossStreak;

    // Matchs
    private int totalMatches;
    private int matchesWon;
    private int matchesLost;
    private int matchesTied;
    private int maxMatchWinStreak;
    private int maxMatchLossStreak;
    private int currentMatchWinStreak;
    private int currentMatchLossStreak;

    // Records
    private long bestGameScore;
    private long worstGameScore;
    private long bestMatchScore;
    private long worstMatchScore;
    private long bestSnapshot;
    private long worstSnapshot;

    // Cumul continu sur toutes les manches, sans tenir compte des matchs (-1 si aucune manche)
    private long globalPeakScore;
    private int globalPeakIndex = -1;
    private long globalTroughScore;
    private int globalTroughIndex = -1;

    public PlayerStatistics() {}

    public PlayerStatistics(Long playerId, String playerName) {
        this.playerId = playerId;
        this.playerName = playerName;
    }

    public double getWinRate() { return percent(gamesWon, totalGames); }

    public double getLandlordWinRate() { return percent(landlordWins, gamesAsLandlord); }

    public double getFarmerWinRate() { return percent(farmerWins, gamesAsFarmer); }

    public double getDoubledWinRate() { return percent(doubledWins, doubledGames); }

    public double getMatchWinRate() { return percent(matchesWon, totalMatches); }

    public double getAverageScorePerGame() {
        return totalGames == 0 ? 0.0 : (double) totalScore / totalGames;
    }

    /** Pourcentage 0..100 ; 0 quand le dénominateur est nul. */
    static double percent(int part, int whole) {
        if (whole == 0) return 0.0;
        return (double) part / whole * 100.0;
    }
}
