package com.prodyna.pac.backend.repository;

import com.prodyna.pac.backend.domain.model.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Person entity.
 *
 * @author PAC Team
 */
@Repository
public interface PersonRepository extends JpaRepository<Person, Long> {

    /**
     * Find all persons affiliated with an organization.
     *
     * @param organizationId Organization ID
     * @return Persons of the organization
     */
    List<Person> findByOrganizationId(Long organizationId);
}
