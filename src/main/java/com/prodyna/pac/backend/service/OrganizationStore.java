package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Organization;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.OrganizationRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;

/**
 * Store for organizations.
 *
 * @author PAC Team
 */
@Service
public class OrganizationStore extends AbstractJpaStore<Organization> {

    public OrganizationStore(
            OrganizationRepository organizationRepository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        super("Organization", organizationRepository, validator, entityManager, metricsService);
    }

    @Override
    protected void applyUpdate(Organization existing, Organization incoming) {
        existing.setName(incoming.getName());
    }
}
