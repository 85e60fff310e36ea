package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.order.Order;
import io.b2mash.transport.backoffice.quote.Quote;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything a spawn run reads: the order, its spawnable quotes in creation order with their
 * eligible top-level lines, and the names of the vehicle categories those quotes and lines refer
 * to.
 */
public record OrderLineTree(
    Order order, List<QuoteBranch> quotes, Map<UUID, String> vehicleCategoryNames) {

  public record QuoteBranch(Quote quote, List<LineNode> lines) {}

  public String vehicleCategoryName(UUID vehicleCategoryId) {
    return vehicleCategoryId != null ? vehicleCategoryNames.get(vehicleCategoryId) : null;
  }
}
