package win.ixuni.strata.core.model;

import lombok.Data;

import java.time.Instant;

/**
 * Base type of every persisted entity
 * <p>
 * Carries the identifier, the soft-delete flag and the mutation metadata stamped by the collection pipeline.
 * Subclasses add their business fields; reference-typed fields may be declared with defaults in {@link EntityType}.
 */
@Data
public abstract class StoredEntity {

    /**
     * Entity id; generated by the store when empty on create
     */
    private String id;

    /**
     * Soft-delete flag
     */
    private boolean deleted;

    private Instant created;

    private Instant lastModified;

    /**
     * Actor that performed the last mutation
     */
    private String lastModifiedBy;
}
