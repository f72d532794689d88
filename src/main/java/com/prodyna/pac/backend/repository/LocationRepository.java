package com.prodyna.pac.backend.repository;

import com.prodyna.pac.backend.domain.model.Location;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for Location entity.
 *
 * @author PAC Team
 */
@Repository
public interface LocationRepository extends JpaRepository<Location, Long> {
}
