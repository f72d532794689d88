package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.dto.RoomRequest;
import com.prodyna.pac.backend.api.dto.RoomResponse;
import com.prodyna.pac.backend.domain.model.Room;
import com.prodyna.pac.backend.service.RoomStore;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for rooms.
 *
 * @author PAC Team
 */
@RestController
@RequestMapping("/rooms")
public class RoomController extends CrudController<Room, RoomRequest, RoomResponse> {

    public RoomController(RoomStore roomStore) {
        super(roomStore);
    }

    @Override
    protected Room toEntity(RoomRequest request) {
        return request.toEntity();
    }

    @Override
    protected RoomResponse toResponse(Room entity) {
        return RoomResponse.fromEntity(entity);
    }
}
