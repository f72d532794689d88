package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Organization;
import com.prodyna.pac.backend.domain.model.Person;

/**
 * Request DTO for creating or replacing a person.
 * The organization is optional and referenced by its id.
 *
 * @author PAC Team
 */
public class PersonRequest {

    private String name;
    private String email;
    private Long organizationId;

    public PersonRequest() {
    }

    public PersonRequest(String name, String email, Long organizationId) {
        this.name = name;
        this.email = email;
        this.organizationId = organizationId;
    }

    public Person toEntity() {
        return Person.builder()
                .name(name)
                .email(email)
                .organization(organizationId != null ? Organization.builder().id(organizationId).build() : null)
                .build();
    }

    // Getters and setters
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

    public Long getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(Long organizationId) {
        this.organizationId = organizationId;
    }
}
