package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.OrderStatus;
import com.orderstream.syncmodel.Station;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class StationService {

    static final int MAX_NAME_LENGTH = 64;

    private static final Logger log = LoggerFactory.getLogger(StationService.class);

    private final EntityRepository<Station> stations;
    private final EntityRepository<Category> categories;
    private final ChangeEventBus bus;

    public StationService(EntityRepository<Station> stations, EntityRepository<Category> categories, ChangeEventBus bus) {
        this.stations = stations;
        this.categories = categories;
        this.bus = bus;
    }

    public List<Station> getAll() {
        return stations.getAll();
    }

    public Station get(String id) {
        return stations.get(id);
    }

    public Station create(String name, List<String> categoryIds, List<OrderStatus> inputStatuses, OrderStatus outputStatus) {
        validate(name, categoryIds, outputStatus);

        Station created = stations.create(
                new Station(null, Validation.trimmed(name), categoryIds, inputStatuses, outputStatus));
        bus.publish(ChangeEnvelope.added(created));
        log.info("Created station {} '{}'", created.id(), created.name());
        return created;
    }

    public Station update(String id, String name, List<String> categoryIds, List<OrderStatus> inputStatuses,
                          OrderStatus outputStatus) {
        stations.get(id);
        validate(name, categoryIds, outputStatus);

        Station updated = stations.update(
                new Station(id, Validation.trimmed(name), categoryIds, inputStatuses, outputStatus));
        bus.publish(ChangeEnvelope.updated(updated));
        log.info("Updated station {}", id);
        return updated;
    }

    public void delete(String id) {
        stations.get(id);
        stations.delete(id);
        bus.publish(ChangeEnvelope.deleted(EntityType.STATION, id));
        log.info("Deleted station {}", id);
    }

    private void validate(String name, List<String> categoryIds, OrderStatus outputStatus) {
        var validation = Validation.start()
                .name("name", name, MAX_NAME_LENGTH)
                .require(outputStatus != null, "output_status is required");
        if (categoryIds != null) {
            for (String categoryId : categoryIds) {
                validation.require(categories.findById(categoryId).isPresent(),
                        "category_ids entry '%s' does not reference an existing category".formatted(categoryId));
            }
        }
        validation.throwIfInvalid();
    }
}
