package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Organization;

/**
 * Response DTO for an organization.
 *
 * @author PAC Team
 */
public class OrganizationResponse {

    private Long id;
    private String name;

    public OrganizationResponse() {
    }

    public OrganizationResponse(Long id, String name) {
        this.id = id;
        this.name = name;
    }

    public static OrganizationResponse fromEntity(Organization organization) {
        if (organization == null) {
            return null;
        }
        return new OrganizationResponse(organization.getId(), organization.getName());
    }

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
}
