package win.ixuni.strata.core.exception;

import lombok.Getter;

/**
 * Commit outcome stayed unknown after every allowed retry
 */
@Getter
public class CommitRetryExhaustedException extends CommitFailedException {

    private final long attempts;

    public CommitRetryExhaustedException(long attempts, Throwable lastFailure) {
        super("CommitRetryExhausted",
                "Commit result still unknown after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }
}
