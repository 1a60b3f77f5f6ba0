package win.ixuni.strata.core.pipeline;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.collection.ForwardingEntityCollection;
import win.ixuni.strata.core.collection.decorator.CachingCollection;
import win.ixuni.strata.core.collection.decorator.DefaultValueCollection;
import win.ixuni.strata.core.collection.decorator.SoftDeleteCollection;
import win.ixuni.strata.core.collection.decorator.TimingCollection;
import win.ixuni.strata.core.collection.decorator.TransactionGuardCollection;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * Collection pipeline builder
 * <p>
 * Wraps a raw driver collection in the decorator layers, outermost first:
 * <pre>
 * [TransactionGuard] -&gt; SoftDelete -&gt; DefaultValue -&gt; Cache -&gt; [Timing] -&gt; raw
 * </pre>
 * Soft delete filters before defaults are applied, so a hidden record never looks found. The cache stores
 * backfilled copies. Timing is only inserted when enabled. The guard wraps everything when a state check is
 * configured, so no layer runs once the transaction has ended.
 */
@Slf4j
public class CollectionPipeline {

    @Getter
    private final PipelineSettings settings;

    public CollectionPipeline(PipelineSettings settings) {
        this.settings = settings;
    }

    /**
     * Compose the decorator layers around a raw collection
     *
     * @param raw driver collection
     * @param <T> entity type
     * @return the outermost layer
     */
    public <T extends StoredEntity> EntityCollection<T> wrap(EntityCollection<T> raw) {
        EntityCollection<T> collection = raw;
        if (settings.isLogTime()) {
            collection = new TimingCollection<>(collection, settings.getLogger());
        }
        collection = new CachingCollection<>(collection, settings.getCache(), settings.isCacheEnabled());
        collection = new DefaultValueCollection<>(collection, settings.getActorId(), settings.getClock());
        collection = new SoftDeleteCollection<>(collection);
        if (settings.getStateCheck() != null) {
            collection = new TransactionGuardCollection<>(collection, settings.getStateCheck());
        }

        if (log.isDebugEnabled()) {
            log.debug("Built pipeline for {}: {}", raw.getEntityType(), describe(collection));
        }
        return collection;
    }

    /**
     * List the layers of a composed collection
     *
     * @return layer class names, outermost first, ending with the raw collection
     */
    public static List<String> describe(EntityCollection<?> collection) {
        List<String> layers = new ArrayList<>();
        EntityCollection<?> current = collection;
        while (current instanceof ForwardingEntityCollection<?> forwarding) {
            layers.add(current.getClass().getSimpleName());
            current = forwarding.getDelegate();
        }
        layers.add(current.getClass().getSimpleName());
        return layers;
    }
}
