package io.b2mash.transport.backoffice.quote;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface QuoteLineRepository extends JpaRepository<QuoteLine, UUID> {

  @Query(
      """
      SELECT l FROM QuoteLine l
      WHERE l.quoteId IN :quoteIds
      ORDER BY l.sortOrder ASC, l.createdAt ASC
      """)
  List<QuoteLine> findByQuoteIds(@Param("quoteIds") Collection<UUID> quoteIds);

  /** Tenant-scoped lookup through the owning quote. Returns the line together with its quote. */
  @Query(
      """
      SELECT l, q FROM QuoteLine l, Quote q
      WHERE l.id = :lineId AND q.id = l.quoteId AND q.organizationId = :organizationId
      """)
  List<Object[]> findWithQuote(
      @Param("lineId") UUID lineId, @Param("organizationId") String organizationId);

  default Optional<LineWithQuote> findByIdForOrganization(UUID lineId, String organizationId) {
    return findWithQuote(lineId, organizationId).stream()
        .findFirst()
        .map(row -> new LineWithQuote((QuoteLine) row[0], (Quote) row[1]));
  }

  @Query(
      """
      SELECT COUNT(l) FROM QuoteLine l, Quote q
      WHERE q.id = l.quoteId AND q.orderId = :orderId AND q.organizationId = :organizationId
        AND q.tripType IN :tripTypes
        AND l.type = io.b2mash.transport.backoffice.quote.QuoteLineType.CALCULATED
      """)
  long countCalculatedLines(
      @Param("orderId") UUID orderId,
      @Param("organizationId") String organizationId,
      @Param("tripTypes") Collection<TripType> tripTypes);

  record LineWithQuote(QuoteLine line, Quote quote) {}
}
