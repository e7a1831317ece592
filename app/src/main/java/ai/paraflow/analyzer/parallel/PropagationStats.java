package ai.paraflow.analyzer.parallel;

/** Counters of one propagation run. {@code seeded} are the inherently parallel functions it started from. */
public record PropagationStats(int rounds, int intraPasses, int interPasses, int seeded, int flagged) {

    public int transitive() {
        return flagged - seeded;
    }
}
