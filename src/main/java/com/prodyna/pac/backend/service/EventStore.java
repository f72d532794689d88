package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Event;
import com.prodyna.pac.backend.exception.FieldViolation;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.EventRepository;
import com.prodyna.pac.backend.repository.LocationRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Store for events.
 *
 * @author PAC Team
 */
@Service
public class EventStore extends AbstractJpaStore<Event> {

    private final EventRepository eventRepository;
    private final LocationRepository locationRepository;

    public EventStore(
            EventRepository eventRepository,
            LocationRepository locationRepository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        super("Event", eventRepository, validator, entityManager, metricsService);
        this.eventRepository = eventRepository;
        this.locationRepository = locationRepository;
    }

    /**
     * Get all events held at a location.
     *
     * @param locationId Location ID
     * @return Events at the location, empty if none
     */
    @Transactional(readOnly = true)
    public List<Event> findByLocationId(Long locationId) {
        return findRelated("findByLocationId", locationId, () -> eventRepository.findByLocationId(locationId));
    }

    @Override
    protected void resolveReferences(Event event, List<FieldViolation> violations) {
        event.setLocation(lookup(locationRepository, event.getLocation(), "location", "Location", violations));
    }

    @Override
    protected void checkConsistency(Event event, List<FieldViolation> violations) {
        if (event.getBeginDate() != null && event.getEndDate() != null
                && event.getEndDate().isBefore(event.getBeginDate())) {
            violations.add(new FieldViolation("endDate", "must not be before beginDate"));
        }
    }

    @Override
    protected void applyUpdate(Event existing, Event incoming) {
        existing.setName(incoming.getName());
        existing.setBeginDate(incoming.getBeginDate());
        existing.setEndDate(incoming.getEndDate());
        existing.setLocation(incoming.getLocation());
    }
}
