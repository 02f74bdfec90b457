package com.orderstream.ordering.api;

import com.orderstream.ordering.api.dto.ActiveEventRequest;
import com.orderstream.ordering.domain.service.SettingsService;
import com.orderstream.security.CallerContext;
import com.orderstream.security.Role;
import com.orderstream.security.RoleChecker;
import com.orderstream.syncmodel.Settings;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** The global settings singleton. It is created on first read. */
@RestController
@RequestMapping("/api/v1/settings")
public class SettingsController {

    private final SettingsService settings;

    public SettingsController(SettingsService settings) {
        this.settings = settings;
    }

    @GetMapping
    public Settings get() {
        return settings.get();
    }

    @PutMapping("/active-event")
    public Settings setActiveEvent(@RequestBody ActiveEventRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return settings.setActiveEvent(request.eventId());
    }
}
