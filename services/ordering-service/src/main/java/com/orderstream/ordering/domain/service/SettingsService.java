package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.Event;
import com.orderstream.syncmodel.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The global settings singleton. The row is created on first read.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    private final EntityRepository<Settings> settings;
    private final EntityRepository<Event> events;
    private final ChangeEventBus bus;

    public SettingsService(EntityRepository<Settings> settings, EntityRepository<Event> events, ChangeEventBus bus) {
        this.settings = settings;
        this.events = events;
        this.bus = bus;
    }

    public synchronized Settings get() {
        var existing = settings.findById(Settings.GLOBAL_ID);
        if (existing.isPresent()) {
            return existing.get();
        }
        Settings created = settings.create(Settings.defaults());
        bus.publish(ChangeEnvelope.added(created));
        log.info("Created global settings");
        return created;
    }

    /**
     * Points the platform at an event. {@code null} clears the active event.
     *
     * @throws com.orderstream.ordering.domain.NotFoundException if the event does not exist
     */
    public synchronized Settings setActiveEvent(String eventId) {
        if (eventId != null) {
            events.get(eventId);
        }
        Settings updated = settings.update(get().withActiveEventId(eventId));
        bus.publish(ChangeEnvelope.updated(updated));
        log.info("Active event set to {}", eventId);
        return updated;
    }
}
