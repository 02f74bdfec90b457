package com.orderstream.ordering.infrastructure.persistence;

import com.orderstream.ordering.domain.NotFoundException;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Identifiable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Process-local store keeping insertion order. Each call is atomic on its own; nothing spans
 * calls.
 *
 * @param <T> entity record type
 */
public class InMemoryEntityRepository<T extends Identifiable> implements EntityRepository<T> {

    private final EntityType entityType;
    private final BiFunction<T, String, T> withId;
    private final Map<String, T> entries = new LinkedHashMap<>();

    /**
     * @param withId copies an entity with a newly assigned id
     */
    public InMemoryEntityRepository(EntityType entityType, BiFunction<T, String, T> withId) {
        this.entityType = entityType;
        this.withId = withId;
    }

    @Override
    public EntityType entityType() {
        return entityType;
    }

    @Override
    public synchronized Optional<T> findById(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public synchronized List<T> getAll() {
        return List.copyOf(entries.values());
    }

    @Override
    public synchronized T create(T entity) {
        T stored = entity.id() == null || entity.id().isBlank()
                ? withId.apply(entity, UUID.randomUUID().toString())
                : entity;
        if (entries.containsKey(stored.id())) {
            throw new IllegalArgumentException("%s '%s' already exists".formatted(entityType.value(), stored.id()));
        }
        entries.put(stored.id(), stored);
        return stored;
    }

    @Override
    public synchronized T update(T entity) {
        if (!entries.containsKey(entity.id())) {
            throw new NotFoundException(entityType, entity.id());
        }
        entries.put(entity.id(), entity);
        return entity;
    }

    @Override
    public synchronized void delete(String id) {
        if (entries.remove(id) == null) {
            throw new NotFoundException(entityType, id);
        }
    }

    protected synchronized List<T> findAll(Predicate<T> filter) {
        var result = new ArrayList<T>();
        for (T entity : entries.values()) {
            if (filter.test(entity)) {
                result.add(entity);
            }
        }
        return result;
    }
}
