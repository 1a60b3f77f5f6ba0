package win.ixuni.strata.core.unitofwork;

import reactor.core.publisher.Mono;

/**
 * Driver transaction session
 * <p>
 * Wraps the store session whose transaction was started when the unit of work was created.
 * Implementations translate store errors on commit: an outcome the store cannot confirm becomes
 * {@link win.ixuni.strata.core.exception.AmbiguousCommitException}, any other failure
 * {@link win.ixuni.strata.core.exception.CommitFailedException}.
 */
public interface TransactionSession extends AutoCloseable {

    /**
     * Make one commit attempt
     */
    Mono<Void> commitTransaction();

    /**
     * Roll the transaction back
     */
    Mono<Void> abortTransaction();

    /**
     * Release the session
     */
    @Override
    void close();
}
