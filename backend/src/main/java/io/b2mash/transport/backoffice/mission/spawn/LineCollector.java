package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.config.SpawnProperties;
import io.b2mash.transport.backoffice.mission.event.SpawnGroupSkippedEvent.SkipReason;
import io.b2mash.transport.backoffice.mission.spawn.CollectedLines.SkippedGroup;
import io.b2mash.transport.backoffice.mission.spawn.LineNode.CalculatedLine;
import io.b2mash.transport.backoffice.mission.spawn.LineNode.GroupLine;
import io.b2mash.transport.backoffice.quote.DateRange;
import io.b2mash.transport.backoffice.quote.LineOverrides;
import io.b2mash.transport.backoffice.quote.Quote;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flattens an order's line tree into spawn candidates, in quote order then line order.
 *
 * <ul>
 *   <li>A CALCULATED line gives one candidate.
 *   <li>A GROUP with children is replaced by its children. A nested GROUP is expanded once more;
 *       groups below that are dropped.
 *   <li>A GROUP without children but with a {@code startDate}/{@code endDate} range gives one
 *       candidate per calendar day, all keyed on the GROUP.
 *   <li>MANUAL lines, non-dispatchable lines and lines that already have a mission are dropped.
 * </ul>
 *
 * A GROUP that can be neither descended into nor expanded is reported in {@link
 * CollectedLines#skippedGroups()} and does not stop the rest of the batch.
 */
@Component
public class LineCollector {

  private static final Logger log = LoggerFactory.getLogger(LineCollector.class);

  /** Level of the deepest GROUP whose children are collected. Top-level lines are level 0. */
  static final int MAX_GROUP_LEVEL = 1;

  private final ZoneId zone;

  public LineCollector(SpawnProperties properties) {
    this.zone = properties.zone();
  }

  public CollectedLines collect(OrderLineTree tree, SpawnedLineGuard guard) {
    var candidates = new ArrayList<SpawnCandidate>();
    var skipped = new ArrayList<SkippedGroup>();
    for (OrderLineTree.QuoteBranch branch : tree.quotes()) {
      for (LineNode node : branch.lines()) {
        collectNode(branch.quote(), node, null, 0, guard, candidates, skipped);
      }
    }
    return new CollectedLines(List.copyOf(candidates), List.copyOf(skipped));
  }

  private void collectNode(
      Quote quote,
      LineNode node,
      UUID groupLineId,
      int level,
      SpawnedLineGuard guard,
      List<SpawnCandidate> candidates,
      List<SkippedGroup> skipped) {
    if (!node.dispatchable()) {
      log.debug("Line {} is not dispatchable, skipping", node.id());
      return;
    }
    if (guard.isSpawned(node.id())) {
      log.debug("Line {} already has a mission, skipping", node.id());
      return;
    }
    if (node instanceof CalculatedLine calculated) {
      candidates.add(SpawnCandidate.single(quote, calculated.line(), groupLineId));
    } else if (node instanceof GroupLine group) {
      collectGroup(quote, group, level, guard, candidates, skipped);
    } else {
      log.debug("Line {} is a manual line, skipping", node.id());
    }
  }

  private void collectGroup(
      Quote quote,
      GroupLine group,
      int level,
      SpawnedLineGuard guard,
      List<SpawnCandidate> candidates,
      List<SkippedGroup> skipped) {
    if (level > MAX_GROUP_LEVEL) {
      log.debug("GROUP {} at level {} is nested too deep, skipping", group.id(), level);
      return;
    }
    if (!group.children().isEmpty()) {
      for (LineNode child : group.children()) {
        collectNode(quote, child, group.id(), level + 1, guard, candidates, skipped);
      }
      return;
    }
    expandDateRange(quote, group, candidates, skipped);
  }

  private void expandDateRange(
      Quote quote, GroupLine group, List<SpawnCandidate> candidates, List<SkippedGroup> skipped) {
    LineOverrides overrides = group.overrides();
    if (!overrides.hasDateRange()) {
      log.info("GROUP {} has no children and no date range, skipping", group.id());
      skipped.add(
          new SkippedGroup(
              quote, group.line(), SkipReason.NO_CHILDREN_OR_RANGE, "No children and no range"));
      return;
    }

    DateRange range;
    try {
      range = DateRange.parse(overrides.startDate(), overrides.endDate(), zone);
    } catch (IllegalArgumentException e) {
      log.warn("GROUP {} has an invalid date range: {}", group.id(), e.getMessage());
      skipped.add(
          new SkippedGroup(quote, group.line(), SkipReason.INVALID_DATE_RANGE, e.getMessage()));
      return;
    }

    List<LocalDate> days = range.days();
    log.info(
        "GROUP {} spans {} days from {} to {}",
        group.id(),
        days.size(),
        range.start(),
        range.end());
    for (int i = 0; i < days.size(); i++) {
      LocalDate day = days.get(i);
      var expansion =
          new DayExpansion(i + 1, days.size(), day, day.atStartOfDay(zone).toInstant());
      candidates.add(SpawnCandidate.day(quote, group.line(), expansion));
    }
  }
}
