package io.b2mash.transport.backoffice.quote;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface QuoteRepository extends JpaRepository<Quote, UUID> {

  @Query(
      """
      SELECT q FROM Quote q
      WHERE q.orderId = :orderId AND q.organizationId = :organizationId
        AND q.tripType IN :tripTypes
      ORDER BY q.createdAt ASC, q.id ASC
      """)
  List<Quote> findByOrderAndTripTypes(
      @Param("orderId") UUID orderId,
      @Param("organizationId") String organizationId,
      @Param("tripTypes") Collection<TripType> tripTypes);

  Optional<Quote> findFirstByOrderIdAndOrganizationIdOrderByCreatedAtAsc(
      UUID orderId, String organizationId);
}
