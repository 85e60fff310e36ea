package io.b2mash.transport.backoffice.testsupport;

import io.b2mash.transport.backoffice.order.Order;
import io.b2mash.transport.backoffice.order.OrderRepository;
import io.b2mash.transport.backoffice.quote.PricingMode;
import io.b2mash.transport.backoffice.quote.Quote;
import io.b2mash.transport.backoffice.quote.QuoteLine;
import io.b2mash.transport.backoffice.quote.QuoteLineRepository;
import io.b2mash.transport.backoffice.quote.QuoteLineType;
import io.b2mash.transport.backoffice.quote.QuoteRepository;
import io.b2mash.transport.backoffice.quote.TripType;
import io.b2mash.transport.backoffice.vehicle.VehicleCategory;
import io.b2mash.transport.backoffice.vehicle.VehicleCategoryRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Persists orders, quotes and line trees for integration tests. */
public class OrderTestData {

  private final OrderRepository orderRepository;
  private final QuoteRepository quoteRepository;
  private final QuoteLineRepository quoteLineRepository;
  private final VehicleCategoryRepository vehicleCategoryRepository;

  public OrderTestData(
      OrderRepository orderRepository,
      QuoteRepository quoteRepository,
      QuoteLineRepository quoteLineRepository,
      VehicleCategoryRepository vehicleCategoryRepository) {
    this.orderRepository = orderRepository;
    this.quoteRepository = quoteRepository;
    this.quoteLineRepository = quoteLineRepository;
    this.vehicleCategoryRepository = vehicleCategoryRepository;
  }

  public Order order(String organizationId) {
    String reference = "ORD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    return orderRepository.saveAndFlush(new Order(organizationId, reference));
  }

  public VehicleCategory vehicleCategory(String organizationId, String name) {
    String code =
        name.toUpperCase().replace(' ', '_') + "_" + UUID.randomUUID().toString().substring(0, 4);
    return vehicleCategoryRepository.saveAndFlush(
        new VehicleCategory(organizationId, name, code, 4));
  }

  public Quote quote(Order order, TripType tripType, Instant pickupAt, UUID vehicleCategoryId) {
    var quote =
        new Quote(
            order.getOrganizationId(),
            order.getId(),
            tripType,
            PricingMode.FIXED_GRID,
            pickupAt,
            vehicleCategoryId);
    quote.setPickup(
        "Gare de Lyon, Paris", new BigDecimal("48.8443000"), new BigDecimal("2.3744000"));
    quote.setDropoff("CDG Terminal 2", new BigDecimal("49.0097000"), new BigDecimal("2.5479000"));
    quote.setPassengers(2, 2);
    return quoteRepository.saveAndFlush(quote);
  }

  public QuoteLine line(Quote quote, QuoteLineType type, String label, int sortOrder) {
    return line(quote, null, type, label, sortOrder, Map.of(), true);
  }

  public QuoteLine line(
      Quote quote,
      QuoteLine parent,
      QuoteLineType type,
      String label,
      int sortOrder,
      Map<String, Object> sourceData,
      boolean dispatchable) {
    var line =
        new QuoteLine(
            quote.getId(), parent != null ? parent.getId() : null, type, label, sortOrder);
    line.setSourceData(sourceData);
    line.setDispatchable(dispatchable);
    line.setTotalPrice(new BigDecimal("95.00"));
    return quoteLineRepository.saveAndFlush(line);
  }
}
