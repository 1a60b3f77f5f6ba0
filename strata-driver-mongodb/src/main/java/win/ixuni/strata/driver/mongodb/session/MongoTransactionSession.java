package win.ixuni.strata.driver.mongodb.session;

import com.mongodb.MongoException;
import com.mongodb.reactivestreams.client.ClientSession;
import lombok.Getter;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.unitofwork.TransactionSession;

/**
 * MongoDB transaction session
 * <p>
 * Wraps a reactive client session whose transaction has already been started.
 */
public class MongoTransactionSession implements TransactionSession {

    @Getter
    private final ClientSession clientSession;

    public MongoTransactionSession(ClientSession clientSession) {
        this.clientSession = clientSession;
    }

    @Override
    public Mono<Void> commitTransaction() {
        return Mono.from(clientSession.commitTransaction())
                .onErrorMap(MongoException.class, MongoCommitErrors::translateCommit);
    }

    @Override
    public Mono<Void> abortTransaction() {
        return Mono.from(clientSession.abortTransaction())
                .onErrorMap(MongoException.class, MongoCommitErrors::translateAbort);
    }

    @Override
    public void close() {
        clientSession.close();
    }
}
