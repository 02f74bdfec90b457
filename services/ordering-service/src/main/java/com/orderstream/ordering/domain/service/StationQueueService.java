package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.ordering.domain.port.OrderItemRepository;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.Product;
import com.orderstream.syncmodel.Station;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * What each kitchen station has to work on, and moving work through it.
 */
@Service
public class StationQueueService {

    private static final Logger log = LoggerFactory.getLogger(StationQueueService.class);

    private final EntityRepository<Station> stations;
    private final EntityRepository<Product> products;
    private final OrderItemRepository orderItems;
    private final OrderItemService orderItemService;

    public StationQueueService(EntityRepository<Station> stations, EntityRepository<Product> products,
                               OrderItemRepository orderItems, OrderItemService orderItemService) {
        this.stations = stations;
        this.products = products;
        this.orderItems = orderItems;
        this.orderItemService = orderItemService;
    }

    /**
     * Items whose product belongs to one of the station's categories and whose status is one of
     * the station's input statuses.
     */
    public List<OrderItem> queue(String stationId) {
        return queue(stations.get(stationId));
    }

    /**
     * Moves queued items to the station's output status through the bulk path. Ids that are not
     * in the station's queue are ignored; an empty or null list advances the whole queue.
     */
    public BulkStatusResult advance(String stationId, Collection<String> itemIds) {
        Station station = stations.get(stationId);
        Set<String> queued = queue(station).stream()
                .map(OrderItem::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        List<String> toAdvance;
        if (itemIds == null || itemIds.isEmpty()) {
            toAdvance = List.copyOf(queued);
        } else {
            toAdvance = itemIds.stream().filter(queued::contains).distinct().toList();
            if (toAdvance.size() < itemIds.size()) {
                log.warn("Station {} ignoring {} items not in its queue", stationId, itemIds.size() - toAdvance.size());
            }
        }
        log.info("Station {} advancing {} items to {}", stationId, toAdvance.size(), station.outputStatus().value());
        return orderItemService.bulkUpdateStatus(toAdvance, station.outputStatus());
    }

    private List<OrderItem> queue(Station station) {
        Map<String, String> categoryByProduct = new HashMap<>();
        for (Product product : products.getAll()) {
            categoryByProduct.put(product.id(), product.categoryId());
        }
        return orderItems.getAll().stream()
                .filter(item -> station.accepts(categoryByProduct.get(item.itemId()), item.status()))
                .toList();
    }
}
