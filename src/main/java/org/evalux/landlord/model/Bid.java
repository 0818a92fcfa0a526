package org.evalux.landlord.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Annonce d'un joueur : ne pas annoncer, 1, 2 ou 3 points. */
public enum Bid {
    NONE(0), ONE(1), TWO(2), THREE(3);

    private final int points;

    Bid(int points) { this.points = points; }

    @JsonValue
    public int getPoints() { return points; }

    @JsonCreator
    public static Bid fromPoints(int points) {
        for (Bid b : values()) {
            if (b.points == points) return b;
        }
        throw new IllegalArgumentException("Annonce invalide (0..3): " + points);
    }
}
