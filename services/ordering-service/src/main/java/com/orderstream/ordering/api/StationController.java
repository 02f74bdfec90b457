package com.orderstream.ordering.api;

import com.orderstream.ordering.api.dto.StationAdvanceRequest;
import com.orderstream.ordering.api.dto.StationRequest;
import com.orderstream.ordering.domain.service.BulkStatusResult;
import com.orderstream.ordering.domain.service.StationQueueService;
import com.orderstream.ordering.domain.service.StationService;
import com.orderstream.security.CallerContext;
import com.orderstream.security.Role;
import com.orderstream.security.RoleChecker;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.Station;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Kitchen stations, their work queues and the advance action station staff use to move items to
 * the station's output status.
 */
@RestController
@RequestMapping("/api/v1/stations")
public class StationController {

    private final StationService stations;
    private final StationQueueService queues;

    public StationController(StationService stations, StationQueueService queues) {
        this.stations = stations;
        this.queues = queues;
    }

    @GetMapping
    public List<Station> list() {
        return stations.getAll();
    }

    @GetMapping("/{id}")
    public Station get(@PathVariable String id) {
        return stations.get(id);
    }

    @GetMapping("/{id}/queue")
    public List<OrderItem> queue(@PathVariable String id) {
        return queues.queue(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Station create(@Valid @RequestBody StationRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return stations.create(request.name(), request.categoryIds(), request.inputStatuses(), request.outputStatus());
    }

    @PutMapping("/{id}")
    public Station update(@PathVariable String id, @Valid @RequestBody StationRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return stations.update(id, request.name(), request.categoryIds(), request.inputStatuses(),
                request.outputStatus());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        stations.delete(id);
    }

    @PostMapping("/{id}/advance")
    public BulkStatusResult advance(@PathVariable String id,
                                    @RequestBody(required = false) StationAdvanceRequest request,
                                    CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.STAFF);
        return queues.advance(id, request == null ? null : request.itemIds());
    }
}
