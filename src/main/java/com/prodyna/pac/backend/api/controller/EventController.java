package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.dto.EventRequest;
import com.prodyna.pac.backend.api.dto.EventResponse;
import com.prodyna.pac.backend.api.dto.TalkResponse;
import com.prodyna.pac.backend.domain.model.Event;
import com.prodyna.pac.backend.service.EventStore;
import com.prodyna.pac.backend.service.TalkStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for events and their program.
 *
 * @author PAC Team
 */
@RestController
@RequestMapping("/events")
public class EventController extends CrudController<Event, EventRequest, EventResponse> {

    private final TalkStore talkStore;

    public EventController(EventStore eventStore, TalkStore talkStore) {
        super(eventStore);
        this.talkStore = talkStore;
    }

    /**
     * Get all talks scheduled at an event.
     *
     * @param id Event ID
     * @return Talks of the event, empty if none
     */
    @GetMapping("/{id:[0-9]+}/talks")
    public ResponseEntity<List<TalkResponse>> getTalks(@PathVariable("id") Long id) {
        logger.debug("Fetching program of event: {}", id);

        List<TalkResponse> talks = talkStore.findByEventId(id).stream()
                .map(TalkResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(talks);
    }

    @Override
    protected Event toEntity(EventRequest request) {
        return request.toEntity();
    }

    @Override
    protected EventResponse toResponse(Event entity) {
        return EventResponse.fromEntity(entity);
    }
}
