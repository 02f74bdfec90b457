package com.orderstream.ordering.api;

import com.orderstream.ordering.api.dto.EventRequest;
import com.orderstream.ordering.domain.service.EventService;
import com.orderstream.security.CallerContext;
import com.orderstream.security.Role;
import com.orderstream.security.RoleChecker;
import com.orderstream.syncmodel.Event;
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

@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventService events;

    public EventController(EventService events) {
        this.events = events;
    }

    @GetMapping
    public List<Event> list() {
        return events.getAll();
    }

    @GetMapping("/{id}")
    public Event get(@PathVariable String id) {
        return events.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Event create(@Valid @RequestBody EventRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return events.create(request.name());
    }

    @PutMapping("/{id}")
    public Event update(@PathVariable String id, @Valid @RequestBody EventRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return events.update(id, request.name());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        events.delete(id);
    }
}
