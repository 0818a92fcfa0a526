package org.evalux.landlord.model;

/**
 * Trois totaux (un par place). Sert aussi bien pour les deltas d'une manche
 * que pour les cumuls d'un match.
 */
public record ScoreTriple(long a, long b, long c) {

    public static final ScoreTriple ZERO = new ScoreTriple(0, 0, 0);

    public long of(Seat seat) {
        return switch (seat) {
            case A -> a;
            case B -> b;
            case C -> c;
        };
    }

    public ScoreTriple plus(ScoreTriple other) {
        return new ScoreTriple(a + other.a, b + other.b, c + other.c);
    }

    public ScoreTriple max(ScoreTriple other) {
        return new ScoreTriple(Math.max(a, other.a), Math.max(b, other.b), Math.max(c, other.c));
    }

    public ScoreTriple min(ScoreTriple other) {
        return new ScoreTriple(Math.min(a, other.a), Math.min(b, other.b), Math.min(c, other.c));
    }

    public long sum() {
        return a + b + c;
    }
}
