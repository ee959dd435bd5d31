package lineup.queue.model;

/**
 * Priority levels. Lower rank is dispatched first.
 */
public enum JobPriority {
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    /** Persisted integer form. */
    public int rank() {
        return rank;
    }

    public static JobPriority fromRank(int rank) {
        for (JobPriority p : values()) {
            if (p.rank == rank) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank: " + rank);
    }
}
