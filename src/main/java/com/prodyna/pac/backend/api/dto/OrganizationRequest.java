package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Organization;

/**
 * Request DTO for creating or replacing an organization.
 *
 * @author PAC Team
 */
public class OrganizationRequest {

    private String name;

    public OrganizationRequest() {
    }

    public OrganizationRequest(String name) {
        this.name = name;
    }

    public Organization toEntity() {
        return Organization.builder()
                .name(name)
                .build();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
