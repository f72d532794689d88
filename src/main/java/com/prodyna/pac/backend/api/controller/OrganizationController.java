package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.dto.OrganizationRequest;
import com.prodyna.pac.backend.api.dto.OrganizationResponse;
import com.prodyna.pac.backend.api.dto.PersonResponse;
import com.prodyna.pac.backend.domain.model.Organization;
import com.prodyna.pac.backend.service.OrganizationStore;
import com.prodyna.pac.backend.service.PersonStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for organizations.
 *
 * @author PAC Team
 */
@RestController
@RequestMapping("/organizations")
public class OrganizationController extends CrudController<Organization, OrganizationRequest, OrganizationResponse> {

    private final PersonStore personStore;

    public OrganizationController(OrganizationStore organizationStore, PersonStore personStore) {
        super(organizationStore);
        this.personStore = personStore;
    }

    /**
     * Get all persons affiliated with an organization.
     *
     * @param id Organization ID
     * @return Persons of the organization, empty if none
     */
    @GetMapping("/{id:[0-9]+}/persons")
    public ResponseEntity<List<PersonResponse>> getPersons(@PathVariable("id") Long id) {
        List<PersonResponse> persons = personStore.findByOrganizationId(id).stream()
                .map(PersonResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(persons);
    }

    @Override
    protected Organization toEntity(OrganizationRequest request) {
        return request.toEntity();
    }

    @Override
    protected OrganizationResponse toResponse(Organization entity) {
        return OrganizationResponse.fromEntity(entity);
    }
}
