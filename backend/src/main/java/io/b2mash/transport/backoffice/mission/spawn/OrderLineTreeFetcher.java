package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.exception.ResourceNotFoundException;
import io.b2mash.transport.backoffice.order.OrderRepository;
import io.b2mash.transport.backoffice.quote.LineOverrides;
import io.b2mash.transport.backoffice.quote.Quote;
import io.b2mash.transport.backoffice.quote.QuoteLine;
import io.b2mash.transport.backoffice.quote.QuoteLineRepository;
import io.b2mash.transport.backoffice.quote.QuoteLineType;
import io.b2mash.transport.backoffice.quote.QuoteRepository;
import io.b2mash.transport.backoffice.quote.TripType;
import io.b2mash.transport.backoffice.vehicle.VehicleCategory;
import io.b2mash.transport.backoffice.vehicle.VehicleCategoryRepository;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Loads the line tree of an order, scoped to one organization. Only TRANSFER and DISPO quotes are
 * read. Top-level lines must be dispatchable CALCULATED or GROUP lines; children are attached two
 * levels deep, each level in {@code sortOrder}.
 */
@Component
public class OrderLineTreeFetcher {

  static final int MAX_CHILD_DEPTH = 2;

  private final OrderRepository orderRepository;
  private final QuoteRepository quoteRepository;
  private final QuoteLineRepository quoteLineRepository;
  private final VehicleCategoryRepository vehicleCategoryRepository;

  public OrderLineTreeFetcher(
      OrderRepository orderRepository,
      QuoteRepository quoteRepository,
      QuoteLineRepository quoteLineRepository,
      VehicleCategoryRepository vehicleCategoryRepository) {
    this.orderRepository = orderRepository;
    this.quoteRepository = quoteRepository;
    this.quoteLineRepository = quoteLineRepository;
    this.vehicleCategoryRepository = vehicleCategoryRepository;
  }

  /**
   * @throws ResourceNotFoundException if the order does not exist in {@code organizationId}
   */
  public OrderLineTree fetch(UUID orderId, String organizationId) {
    var order =
        orderRepository
            .findByIdAndOrganizationId(orderId, organizationId)
            .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));

    List<Quote> quotes =
        quoteRepository.findByOrderAndTripTypes(orderId, organizationId, TripType.spawnable());
    if (quotes.isEmpty()) {
      return new OrderLineTree(order, List.of(), Map.of());
    }

    List<QuoteLine> lines =
        quoteLineRepository.findByQuoteIds(quotes.stream().map(Quote::getId).toList());
    Map<UUID, List<QuoteLine>> childrenByParent = new HashMap<>();
    Map<UUID, List<QuoteLine>> topLevelByQuote = new HashMap<>();
    for (QuoteLine line : lines) {
      if (line.getParentId() == null) {
        topLevelByQuote.computeIfAbsent(line.getQuoteId(), k -> new ArrayList<>()).add(line);
      } else {
        childrenByParent.computeIfAbsent(line.getParentId(), k -> new ArrayList<>()).add(line);
      }
    }

    var branches = new ArrayList<OrderLineTree.QuoteBranch>();
    for (Quote quote : quotes) {
      List<LineNode> topLevel =
          topLevelByQuote.getOrDefault(quote.getId(), List.of()).stream()
              .filter(QuoteLine::isDispatchable)
              .filter(line -> line.getType() != QuoteLineType.MANUAL)
              .map(line -> toNode(line, childrenByParent, 0))
              .toList();
      branches.add(new OrderLineTree.QuoteBranch(quote, topLevel));
    }

    return new OrderLineTree(order, branches, loadCategoryNames(organizationId, quotes, lines));
  }

  private LineNode toNode(
      QuoteLine line, Map<UUID, List<QuoteLine>> childrenByParent, int level) {
    if (line.getType() != QuoteLineType.GROUP || level >= MAX_CHILD_DEPTH) {
      return LineNode.of(line, List.of());
    }
    List<LineNode> children =
        childrenByParent.getOrDefault(line.getId(), List.of()).stream()
            .map(child -> toNode(child, childrenByParent, level + 1))
            .toList();
    return LineNode.of(line, children);
  }

  private Map<UUID, String> loadCategoryNames(
      String organizationId, List<Quote> quotes, List<QuoteLine> lines) {
    var ids = new HashSet<UUID>();
    quotes.stream().map(Quote::getVehicleCategoryId).filter(Objects::nonNull).forEach(ids::add);
    lines.stream()
        .map(line -> LineOverrides.from(line.getSourceData()).vehicleCategoryId())
        .filter(Objects::nonNull)
        .forEach(ids::add);
    if (ids.isEmpty()) {
      return Map.of();
    }
    return vehicleCategoryRepository.findAllByOrganizationIdAndIdIn(organizationId, ids).stream()
        .collect(Collectors.toMap(VehicleCategory::getId, VehicleCategory::getName));
  }
}
