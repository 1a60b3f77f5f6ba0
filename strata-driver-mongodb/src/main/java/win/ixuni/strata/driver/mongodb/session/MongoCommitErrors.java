package win.ixuni.strata.driver.mongodb.session;

import com.mongodb.MongoException;
import win.ixuni.strata.core.exception.AbortFailedException;
import win.ixuni.strata.core.exception.AmbiguousCommitException;
import win.ixuni.strata.core.exception.CommitFailedException;

/**
 * Translation of MongoDB transaction errors
 */
public final class MongoCommitErrors {

    private MongoCommitErrors() {
    }

    /**
     * Classify a commit error by its error labels
     * <p>
     * {@code UnknownTransactionCommitResult} means the server may or may not have applied the commit; such
     * commits can be retried. Everything else is final.
     */
    public static RuntimeException translateCommit(MongoException error) {
        if (error.hasErrorLabel(MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL)) {
            return new AmbiguousCommitException("UnknownTransactionCommitResult: " + error.getMessage(), error);
        }
        return new CommitFailedException(error.getMessage(), error);
    }

    public static RuntimeException translateAbort(MongoException error) {
        return new AbortFailedException("Error during abort: " + error.getMessage(), error);
    }
}
