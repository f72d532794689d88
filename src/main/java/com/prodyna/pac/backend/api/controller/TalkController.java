package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.dto.TalkRequest;
import com.prodyna.pac.backend.api.dto.TalkResponse;
import com.prodyna.pac.backend.domain.model.Talk;
import com.prodyna.pac.backend.service.TalkStore;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for talks.
 * Persons, topics and talk dates are always written together with the talk.
 *
 * @author PAC Team
 */
@RestController
@RequestMapping("/talks")
public class TalkController extends CrudController<Talk, TalkRequest, TalkResponse> {

    public TalkController(TalkStore talkStore) {
        super(talkStore);
    }

    @Override
    protected Talk toEntity(TalkRequest request) {
        return request.toEntity();
    }

    @Override
    protected TalkResponse toResponse(Talk entity) {
        return TalkResponse.fromEntity(entity);
    }
}
