package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Person;
import com.prodyna.pac.backend.exception.FieldViolation;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.OrganizationRepository;
import com.prodyna.pac.backend.repository.PersonRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Store for persons (speakers).
 *
 * @author PAC Team
 */
@Service
public class PersonStore extends AbstractJpaStore<Person> {

    private final PersonRepository personRepository;
    private final OrganizationRepository organizationRepository;

    public PersonStore(
            PersonRepository personRepository,
            OrganizationRepository organizationRepository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        super("Person", personRepository, validator, entityManager, metricsService);
        this.personRepository = personRepository;
        this.organizationRepository = organizationRepository;
    }

    /**
     * Get all persons affiliated with an organization.
     *
     * @param organizationId Organization ID
     * @return Persons of the organization, empty if none
     */
    @Transactional(readOnly = true)
    public List<Person> findByOrganizationId(Long organizationId) {
        return findRelated("findByOrganizationId", organizationId,
                () -> personRepository.findByOrganizationId(organizationId));
    }

    @Override
    protected void resolveReferences(Person person, List<FieldViolation> violations) {
        person.setOrganization(
                lookup(organizationRepository, person.getOrganization(), "organization", "Organization", violations));
    }

    @Override
    protected void applyUpdate(Person existing, Person incoming) {
        existing.setName(incoming.getName());
        existing.setEmail(incoming.getEmail());
        existing.setOrganization(incoming.getOrganization());
    }
}
