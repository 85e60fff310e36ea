package io.b2mash.transport.backoffice.vehicle;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VehicleCategoryRepository extends JpaRepository<VehicleCategory, UUID> {

  Optional<VehicleCategory> findByIdAndOrganizationId(UUID id, String organizationId);

  @Query(
      "SELECT v FROM VehicleCategory v WHERE v.organizationId = :organizationId AND v.id IN :ids")
  List<VehicleCategory> findAllByOrganizationIdAndIdIn(
      @Param("organizationId") String organizationId, @Param("ids") Collection<UUID> ids);
}
