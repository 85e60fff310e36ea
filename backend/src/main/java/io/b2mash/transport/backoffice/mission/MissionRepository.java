package io.b2mash.transport.backoffice.mission;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MissionRepository extends JpaRepository<Mission, UUID> {

  @Query(
      """
      SELECT m FROM Mission m
      WHERE m.orderId = :orderId AND m.organizationId = :organizationId
      ORDER BY m.startAt ASC, m.ref ASC
      """)
  List<Mission> findByOrder(
      @Param("orderId") UUID orderId, @Param("organizationId") String organizationId);

  /** Quote line ids of the order that already carry at least one mission. */
  @Query(
      """
      SELECT DISTINCT m.quoteLineId FROM Mission m
      WHERE m.orderId = :orderId AND m.organizationId = :organizationId
        AND m.quoteLineId IS NOT NULL
      """)
  List<UUID> findSpawnedQuoteLineIds(
      @Param("orderId") UUID orderId, @Param("organizationId") String organizationId);

  boolean existsByOrderIdAndOrganizationId(UUID orderId, String organizationId);

  boolean existsByQuoteLineId(UUID quoteLineId);

  /**
   * Re-reads freshly inserted rows. Filters on the attempted quote lines as well as the inserted
   * ids so rows written by a concurrent run are never returned.
   */
  @Query(
      """
      SELECT m FROM Mission m
      WHERE m.orderId = :orderId AND m.quoteLineId IN :quoteLineIds AND m.id IN :ids
      ORDER BY m.startAt ASC, m.ref ASC
      """)
  List<Mission> findCreated(
      @Param("orderId") UUID orderId,
      @Param("quoteLineIds") Collection<UUID> quoteLineIds,
      @Param("ids") Collection<UUID> ids);

  @Query("SELECT m FROM Mission m WHERE m.id IN :ids ORDER BY m.startAt ASC")
  List<Mission> findByIdsOrderByStartAt(@Param("ids") Collection<UUID> ids);
}
