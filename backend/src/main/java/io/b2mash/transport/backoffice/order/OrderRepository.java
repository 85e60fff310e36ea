package io.b2mash.transport.backoffice.order;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrderRepository extends JpaRepository<Order, UUID> {

  /** Tenant-scoped lookup. An order of another organization is reported as absent. */
  Optional<Order> findByIdAndOrganizationId(UUID id, String organizationId);
}
