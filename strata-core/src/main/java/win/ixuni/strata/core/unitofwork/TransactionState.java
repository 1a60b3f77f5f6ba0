package win.ixuni.strata.core.unitofwork;

/**
 * Transaction lifecycle
 * <p>
 * A unit of work starts its transaction when it is constructed; every other state is terminal.
 */
public enum TransactionState {

    STARTED,

    COMMITTED,

    ABORTED,

    /**
     * Commit or abort failed definitively
     */
    FAILED;

    public boolean isTerminal() {
        return this != STARTED;
    }
}
