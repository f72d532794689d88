package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Room;
import com.prodyna.pac.backend.exception.FieldViolation;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.LocationRepository;
import com.prodyna.pac.backend.repository.RoomRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Store for rooms. Every room must belong to an existing location.
 *
 * @author PAC Team
 */
@Service
public class RoomStore extends AbstractJpaStore<Room> {

    private final RoomRepository roomRepository;
    private final LocationRepository locationRepository;

    public RoomStore(
            RoomRepository roomRepository,
            LocationRepository locationRepository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        super("Room", roomRepository, validator, entityManager, metricsService);
        this.roomRepository = roomRepository;
        this.locationRepository = locationRepository;
    }

    /**
     * Get all rooms of a location.
     *
     * @param locationId Location ID
     * @return Rooms of the location, empty if none
     */
    @Transactional(readOnly = true)
    public List<Room> findByLocationId(Long locationId) {
        return findRelated("findByLocationId", locationId, () -> roomRepository.findByLocationId(locationId));
    }

    @Override
    protected void resolveReferences(Room room, List<FieldViolation> violations) {
        room.setLocation(lookup(locationRepository, room.getLocation(), "location", "Location", violations));
    }

    @Override
    protected void applyUpdate(Room existing, Room incoming) {
        existing.setName(incoming.getName());
        existing.setCapacity(incoming.getCapacity());
        existing.setLocation(incoming.getLocation());
    }
}
