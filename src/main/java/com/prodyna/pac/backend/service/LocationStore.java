package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Location;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.LocationRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;

/**
 * Store for locations.
 *
 * @author PAC Team
 */
@Service
public class LocationStore extends AbstractJpaStore<Location> {

    public LocationStore(
            LocationRepository locationRepository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        super("Location", locationRepository, validator, entityManager, metricsService);
    }

    @Override
    protected void applyUpdate(Location existing, Location incoming) {
        existing.setName(incoming.getName());
        existing.setLat(incoming.getLat());
        existing.setLon(incoming.getLon());
    }
}
