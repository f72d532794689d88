package com.prodyna.pac.backend.repository;

import com.prodyna.pac.backend.domain.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Event entity.
 *
 * @author PAC Team
 */
@Repository
public interface EventRepository extends JpaRepository<Event, Long> {

    /**
     * Find all events held at a location.
     *
     * @param locationId Location ID
     * @return Events at the location
     */
    List<Event> findByLocationId(Long locationId);
}
