package tree.gst;

// Immutable configuration for constructing GeneralizedSuffixTree instances.
public final class SuffixTreeConfiguration {

    private final int initialNodeCapacity;
    private final int expectedStrings;
    private final boolean collectStats;
    private final boolean verifyInvariants;

    private SuffixTreeConfiguration(Builder builder) {
        this.initialNodeCapacity = builder.initialNodeCapacity;
        this.expectedStrings = builder.expectedStrings;
        this.collectStats = builder.collectStats;
        this.verifyInvariants = builder.verifyInvariants;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return new Builder().build(); }

    private void validate() {
        if (initialNodeCapacity <= 0) {
            throw new IllegalArgumentException("initialNodeCapacity must be positive");
        }
        if (expectedStrings <= 0) {
            throw new IllegalArgumentException("expectedStrings must be positive");
        }
    }

    public int initialNodeCapacity() { return initialNodeCapacity; }
    public int expectedStrings() { return expectedStrings; }
    public boolean collectStats() { return collectStats; }
    public boolean verifyInvariants() { return verifyInvariants; }

    public static final class Builder {
        private int initialNodeCapacity = 64;
        private int expectedStrings = 16;
        private boolean collectStats;
        private boolean verifyInvariants;

        private Builder() {
        }

        public Builder initialNodeCapacity(int initialNodeCapacity) {
            this.initialNodeCapacity = initialNodeCapacity;
            return this;
        }

        public Builder expectedStrings(int expectedStrings) {
            this.expectedStrings = expectedStrings;
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        // Run TreeVerifier over the whole tree after every accepted string.
        public Builder verifyInvariants(boolean verifyInvariants) {
            this.verifyInvariants = verifyInvariants;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
