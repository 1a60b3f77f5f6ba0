package win.ixuni.strata.core.collection.decorator;

import org.slf4j.Logger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.collection.ForwardingEntityCollection;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 耗时日志装饰器
 * <p>
 * 记录每个操作的耗时，被包装调用的结果和错误原样传递。
 *
 * @param <T> 实体类型
 */
public class TimingCollection<T extends StoredEntity> extends ForwardingEntityCollection<T> {

    private final Logger logger;

    public TimingCollection(EntityCollection<T> delegate, Logger logger) {
        super(delegate);
        this.logger = logger;
    }

    @Override
    public Mono<T> create(T entity) {
        return timed("Create", () -> delegate.create(entity));
    }

    @Override
    public Flux<T> createAll(List<T> entities) {
        return timedMany("CreateAll", () -> delegate.createAll(entities));
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        return timed("FindById", () -> delegate.findById(id, mode));
    }

    @Override
    public Flux<T> find(EntityFilter filter, ReadMode mode) {
        return timedMany("Find", () -> delegate.find(filter, mode));
    }

    @Override
    public Mono<T> update(T entity) {
        return timed("Update", () -> delegate.update(entity));
    }

    @Override
    public Flux<T> updateAll(List<T> entities) {
        return timedMany("UpdateAll", () -> delegate.updateAll(entities));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return timed("Delete", () -> delegate.delete(id));
    }

    @Override
    public Mono<Long> deleteAll(Collection<String> ids) {
        return timed("DeleteAll", () -> delegate.deleteAll(ids));
    }

    private <R> Mono<R> timed(String operation, Supplier<Mono<R>> call) {
        return Mono.defer(() -> {
            long startTime = System.nanoTime();
            return call.get().doFinally(signal -> report(operation, signal, startTime));
        });
    }

    private <R> Flux<R> timedMany(String operation, Supplier<Flux<R>> call) {
        return Flux.defer(() -> {
            long startTime = System.nanoTime();
            return call.get().doFinally(signal -> report(operation, signal, startTime));
        });
    }

    private void report(String operation, SignalType signal, long startTime) {
        long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
        switch (signal) {
            case ON_COMPLETE -> logger.info("[{}] {} completed in {}ms", collectionName(), operation, duration);
            case ON_ERROR -> logger.warn("[{}] {} failed after {}ms", collectionName(), operation, duration);
            default -> logger.info("[{}] {} cancelled after {}ms", collectionName(), operation, duration);
        }
    }
}
