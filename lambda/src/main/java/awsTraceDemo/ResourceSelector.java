package awsTraceDemo;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Round-robin picker for the table, bucket and endpoint a single invocation works against.
 * The pick is derived from the wall clock only: every invocation inside the same second
 * lands on the same candidate, consecutive seconds cycle through all of them.
 */
public final class ResourceSelector {

    private ResourceSelector() {
    }

    /**
     * Builds the candidates base, base-2, base-3 ... and picks one of them for the current second.
     *
     * @param baseName first candidate, also the prefix of the others
     * @param replicas number of candidates, at least 1
     * @param clock source of the current time
     * @return the candidates and the selected one
     */
    public static Selection select(String baseName, int replicas, Clock clock) {
        if (baseName == null || baseName.isBlank()) {
            throw new IllegalArgumentException("Resource base name must not be empty");
        }
        if (replicas < 1) {
            throw new IllegalArgumentException("Replica count must be positive, got " + replicas);
        }
        List<String> candidates = new ArrayList<>(replicas);
        candidates.add(baseName);
        for (int i = 2; i <= replicas; i++) {
            candidates.add(baseName + "-" + i);
        }
        return select(candidates, clock);
    }

    /**
     * Picks one of an explicit list of candidates for the current second.
     *
     * @param candidates ordered candidates, not empty
     * @param clock source of the current time
     * @return the candidates and the selected one
     */
    public static Selection select(List<String> candidates, Clock clock) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate is required");
        }
        int index = indexFor(clock.millis() / 1000L, candidates.size());
        return new Selection(Collections.unmodifiableList(new ArrayList<>(candidates)), index);
    }

    static int indexFor(long epochSecond, int size) {
        return (int) Math.floorMod(epochSecond, (long) size);
    }

    /**
     * Outcome of one selection. Immutable.
     */
    public static final class Selection {
        private final List<String> candidates;
        private final int index;

        Selection(List<String> candidates, int index) {
            this.candidates = candidates;
            this.index = index;
        }

        public List<String> getCandidates() {
            return candidates;
        }

        public int getIndex() {
            return index;
        }

        public String getSelected() {
            return candidates.get(index);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Selection)) {
                return false;
            }
            Selection other = (Selection) o;
            return index == other.index && candidates.equals(other.candidates);
        }

        @Override
        public int hashCode() {
            return 31 * candidates.hashCode() + index;
        }

        @Override
        public String toString() {
            return "Selection{selected=" + getSelected() + ", index=" + index + ", candidates=" + candidates + "}";
        }
    }
}
