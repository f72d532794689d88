package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.dto.PersonRequest;
import com.prodyna.pac.backend.api.dto.PersonResponse;
import com.prodyna.pac.backend.api.dto.TalkResponse;
import com.prodyna.pac.backend.domain.model.Person;
import com.prodyna.pac.backend.service.PersonStore;
import com.prodyna.pac.backend.service.TalkStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for persons (speakers).
 *
 * @author PAC Team
 */
@RestController
@RequestMapping("/persons")
public class PersonController extends CrudController<Person, PersonRequest, PersonResponse> {

    private final TalkStore talkStore;

    public PersonController(PersonStore personStore, TalkStore talkStore) {
        super(personStore);
        this.talkStore = talkStore;
    }

    /**
     * Get all talks held by a person.
     *
     * @param id Person ID
     * @return Talks of the person, empty if none
     */
    @GetMapping("/{id:[0-9]+}/talks")
    public ResponseEntity<List<TalkResponse>> getTalks(@PathVariable("id") Long id) {
        List<TalkResponse> talks = talkStore.findByPersonId(id).stream()
                .map(TalkResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(talks);
    }

    @Override
    protected Person toEntity(PersonRequest request) {
        return request.toEntity();
    }

    @Override
    protected PersonResponse toResponse(Person entity) {
        return PersonResponse.fromEntity(entity);
    }
}
