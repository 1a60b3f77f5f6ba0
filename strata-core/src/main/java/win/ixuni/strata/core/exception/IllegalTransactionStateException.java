package win.ixuni.strata.core.exception;

import win.ixuni.strata.core.unitofwork.TransactionState;

/**
 * Operation attempted on a unit of work whose transaction is no longer started
 */
public class IllegalTransactionStateException extends StrataException {

    public IllegalTransactionStateException(TransactionState state) {
        super("TransactionClosed", "Transaction is " + state + ", no further operations are allowed");
    }
}
