package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.ValidationException;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Event;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EventService {

    static final int MAX_NAME_LENGTH = 64;

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EntityRepository<Event> events;
    private final SettingsService settings;
    private final ChangeEventBus bus;

    public EventService(EntityRepository<Event> events, SettingsService settings, ChangeEventBus bus) {
        this.events = events;
        this.settings = settings;
        this.bus = bus;
    }

    public List<Event> getAll() {
        return events.getAll();
    }

    public Event get(String id) {
        return events.get(id);
    }

    public Event create(String name) {
        Validation.start().name("name", name, MAX_NAME_LENGTH).throwIfInvalid();

        Event created = events.create(new Event(null, Validation.trimmed(name)));
        bus.publish(ChangeEnvelope.added(created));
        log.info("Created event {} '{}'", created.id(), created.name());
        return created;
    }

    public Event update(String id, String name) {
        events.get(id);
        Validation.start().name("name", name, MAX_NAME_LENGTH).throwIfInvalid();

        Event updated = events.update(new Event(id, Validation.trimmed(name)));
        bus.publish(ChangeEnvelope.updated(updated));
        log.info("Updated event {}", id);
        return updated;
    }

    public void delete(String id) {
        events.get(id);
        if (id.equals(settings.get().activeEventId())) {
            throw new ValidationException("Event '%s' is the active event".formatted(id));
        }

        events.delete(id);
        bus.publish(ChangeEnvelope.deleted(EntityType.EVENT, id));
        log.info("Deleted event {}", id);
    }
}
