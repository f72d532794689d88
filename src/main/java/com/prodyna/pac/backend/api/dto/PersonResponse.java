package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Person;

/**
 * Response DTO for a person, embedding the organization if any.
 *
 * @author PAC Team
 */
public class PersonResponse {

    private Long id;
    private String name;
    private String email;
    private OrganizationResponse organization;

    public PersonResponse() {
    }

    public static PersonResponse fromEntity(Person person) {
        PersonResponse response = new PersonResponse();
        response.setId(person.getId());
        response.setName(person.getName());
        response.setEmail(person.getEmail());
        response.setOrganization(OrganizationResponse.fromEntity(person.getOrganization()));
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public OrganizationResponse getOrganization() {
        return organization;
    }

    public void setOrganization(OrganizationResponse organization) {
        this.organization = organization;
    }
}
