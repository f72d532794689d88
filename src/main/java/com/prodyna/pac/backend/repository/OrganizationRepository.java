package com.prodyna.pac.backend.repository;

import com.prodyna.pac.backend.domain.model.Organization;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for Organization entity.
 *
 * @author PAC Team
 */
@Repository
public interface OrganizationRepository extends JpaRepository<Organization, Long> {
}
