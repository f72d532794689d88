package com.prodyna.pac.backend.repository;

import com.prodyna.pac.backend.domain.model.Room;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Room entity.
 * The location of a room is loaded eagerly with it.
 *
 * @author PAC Team
 */
@Repository
public interface RoomRepository extends JpaRepository<Room, Long> {

    /**
     * Find all rooms of a location.
     *
     * @param locationId Location ID
     * @return Rooms of the location
     */
    List<Room> findByLocationId(Long locationId);
}
