package com.orderstream.ordering.domain.port;

import com.orderstream.ordering.domain.NotFoundException;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Identifiable;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for one entity type. Implementations publish nothing; the calling service
 * publishes after a successful write.
 *
 * @param <T> entity record type
 */
public interface EntityRepository<T extends Identifiable> {

    EntityType entityType();

    Optional<T> findById(String id);

    /**
     * @throws NotFoundException if no entity has this id
     */
    default T get(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException(entityType(), id));
    }

    List<T> getAll();

    /**
     * Stores a new entity. A blank id is replaced by a generated one.
     *
     * @return the stored entity, carrying its final id
     * @throws IllegalArgumentException if an entity with the same id already exists
     */
    T create(T entity);

    /**
     * @throws NotFoundException if no entity has the given entity's id
     */
    T update(T entity);

    /**
     * @throws NotFoundException if no entity has this id
     */
    void delete(String id);
}
