package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.dto.EventResponse;
import com.prodyna.pac.backend.api.dto.LocationRequest;
import com.prodyna.pac.backend.api.dto.LocationResponse;
import com.prodyna.pac.backend.api.dto.RoomResponse;
import com.prodyna.pac.backend.domain.model.Location;
import com.prodyna.pac.backend.service.EventStore;
import com.prodyna.pac.backend.service.LocationStore;
import com.prodyna.pac.backend.service.RoomStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for locations and the rooms and events they host.
 *
 * @author PAC Team
 */
@RestController
@RequestMapping("/locations")
public class LocationController extends CrudController<Location, LocationRequest, LocationResponse> {

    private final RoomStore roomStore;
    private final EventStore eventStore;

    public LocationController(LocationStore locationStore, RoomStore roomStore, EventStore eventStore) {
        super(locationStore);
        this.roomStore = roomStore;
        this.eventStore = eventStore;
    }

    /**
     * Get all rooms of a location.
     *
     * @param id Location ID
     * @return Rooms of the location, empty if none
     */
    @GetMapping("/{id:[0-9]+}/rooms")
    public ResponseEntity<List<RoomResponse>> getRooms(@PathVariable("id") Long id) {
        List<RoomResponse> rooms = roomStore.findByLocationId(id).stream()
                .map(RoomResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(rooms);
    }

    /**
     * Get all events held at a location.
     *
     * @param id Location ID
     * @return Events at the location, empty if none
     */
    @GetMapping("/{id:[0-9]+}/events")
    public ResponseEntity<List<EventResponse>> getEvents(@PathVariable("id") Long id) {
        List<EventResponse> events = eventStore.findByLocationId(id).stream()
                .map(EventResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(events);
    }

    @Override
    protected Location toEntity(LocationRequest request) {
        return request.toEntity();
    }

    @Override
    protected LocationResponse toResponse(Location entity) {
        return LocationResponse.fromEntity(entity);
    }
}
