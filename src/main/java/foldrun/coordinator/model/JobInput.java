package foldrun.coordinator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a submitted folding job.
 * Written once per submission; a later submission with the same id replaces it.
 */
public final class JobInput {
    private final String jobId;
    private final String sequence;
    private final List<String> directions;
    private final JobParams params;
    private final Instant submittedAt;

    private JobInput(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.sequence = Objects.requireNonNull(builder.sequence, "sequence is required");
        this.directions = builder.directions != null ? List.copyOf(builder.directions) : List.of();
        this.params = builder.params != null ? builder.params : JobParams.defaults();
        this.submittedAt = builder.submittedAt;
    }

    public String jobId() {
        return jobId;
    }

    public String sequence() {
        return sequence;
    }

    public List<String> directions() {
        return directions;
    }

    public JobParams params() {
        return params;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .jobId(jobId)
                .sequence(sequence)
                .directions(directions)
                .params(params)
                .submittedAt(submittedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String jobId;
        private String sequence;
        private List<String> directions;
        private JobParams params;
        private Instant submittedAt;

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder sequence(String sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder directions(List<String> directions) {
            this.directions = directions;
            return this;
        }

        public Builder params(JobParams params) {
            this.params = params;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public JobInput build() {
            return new JobInput(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobInput that))
            return false;
        return jobId.equals(that.jobId)
                && sequence.equals(that.sequence)
                && directions.equals(that.directions)
                && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, sequence, directions, params);
    }

    @Override
    public String toString() {
        return "JobInput{id='" + jobId + "', length=" + sequence.length()
                + ", protocol=" + params.protocol().wireName() + "}";
    }
}
