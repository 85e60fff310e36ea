package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.exception.InvalidStateException;
import io.b2mash.transport.backoffice.exception.ResourceConflictException;
import io.b2mash.transport.backoffice.exception.ResourceNotFoundException;
import io.b2mash.transport.backoffice.mission.Mission;
import io.b2mash.transport.backoffice.mission.MissionRepository;
import io.b2mash.transport.backoffice.mission.event.SpawnGroupSkippedEvent;
import io.b2mash.transport.backoffice.mission.event.SpawnOrigin;
import io.b2mash.transport.backoffice.order.Order;
import io.b2mash.transport.backoffice.order.OrderRepository;
import io.b2mash.transport.backoffice.quote.Quote;
import io.b2mash.transport.backoffice.quote.QuoteLineRepository;
import io.b2mash.transport.backoffice.quote.QuoteRepository;
import io.b2mash.transport.backoffice.quote.TripType;
import io.b2mash.transport.backoffice.vehicle.VehicleCategory;
import io.b2mash.transport.backoffice.vehicle.VehicleCategoryRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns the quote lines of an order into missions.
 *
 * <p>{@link #execute} is safe to call any number of times for the same order: lines that already
 * have a mission are skipped, and a concurrent run is absorbed by the writer. Reading, expansion,
 * sorting and resolution happen outside any transaction; only the insert is transactional.
 */
@Service
public class SpawnService {

  private static final Logger log = LoggerFactory.getLogger(SpawnService.class);

  private final OrderLineTreeFetcher treeFetcher;
  private final LineCollector lineCollector;
  private final PickupDateExtractor pickupDateExtractor;
  private final MissionRefGenerator refGenerator;
  private final MissionFieldResolver fieldResolver;
  private final MissionBulkWriter writer;
  private final MissionRepository missionRepository;
  private final OrderRepository orderRepository;
  private final QuoteRepository quoteRepository;
  private final QuoteLineRepository quoteLineRepository;
  private final VehicleCategoryRepository vehicleCategoryRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public SpawnService(
      OrderLineTreeFetcher treeFetcher,
      LineCollector lineCollector,
      PickupDateExtractor pickupDateExtractor,
      MissionRefGenerator refGenerator,
      MissionFieldResolver fieldResolver,
      MissionBulkWriter writer,
      MissionRepository missionRepository,
      OrderRepository orderRepository,
      QuoteRepository quoteRepository,
      QuoteLineRepository quoteLineRepository,
      VehicleCategoryRepository vehicleCategoryRepository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.treeFetcher = treeFetcher;
    this.lineCollector = lineCollector;
    this.pickupDateExtractor = pickupDateExtractor;
    this.refGenerator = refGenerator;
    this.fieldResolver = fieldResolver;
    this.writer = writer;
    this.missionRepository = missionRepository;
    this.orderRepository = orderRepository;
    this.quoteRepository = quoteRepository;
    this.quoteLineRepository = quoteLineRepository;
    this.vehicleCategoryRepository = vehicleCategoryRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Spawns the missions of every eligible line of the order that has none yet.
   *
   * @return the missions created by this call, ordered by start time; empty when nothing was left
   *     to spawn
   * @throws ResourceNotFoundException if the order does not exist in {@code organizationId}
   */
  public List<Mission> execute(UUID orderId, String organizationId) {
    OrderLineTree tree = treeFetcher.fetch(orderId, organizationId);
    Order order = tree.order();
    if (tree.quotes().isEmpty()) {
      log.info("Order {} has no TRANSFER or DISPO quotes, nothing to spawn", orderId);
      return List.of();
    }

    var guard =
        SpawnedLineGuard.of(missionRepository.findSpawnedQuoteLineIds(orderId, organizationId));
    CollectedLines collected = lineCollector.collect(tree, guard);
    publishSkippedGroups(order, collected.skippedGroups());
    if (collected.isEmpty()) {
      log.info(
          "Order {} has no unspawned lines ({} lines already spawned)", orderId, guard.size());
      return List.of();
    }

    List<ScheduledCandidate> sorted =
        ChronologicalSorter.sort(collected.candidates(), pickupDateExtractor::extract);
    int total = sorted.size();
    var prepared = new ArrayList<PreparedMission>(total);
    for (int i = 0; i < total; i++) {
      String ref = refGenerator.refFor(order.getReference(), i);
      prepared.add(fieldResolver.resolve(order, sorted.get(i), ref, i + 1, total, tree));
    }

    List<Mission> created = writer.insertAll(prepared, SpawnOrigin.AUTOMATIC);
    log.info(
        "Spawned {} missions for order {} ({} candidates, {} lines already spawned)",
        created.size(),
        order.getReference(),
        total,
        guard.size());
    return created;
  }

  /**
   * Spawns one mission for a line the automatic run left out, typically a MANUAL or
   * non-dispatchable line.
   *
   * @throws ResourceNotFoundException if the line or the vehicle category is unknown to the
   *     organization
   * @throws InvalidStateException if the line belongs to another order
   * @throws ResourceConflictException if the line already has a mission
   */
  public Mission spawnManual(SpawnManualParams params) {
    var found =
        quoteLineRepository
            .findByIdForOrganization(params.quoteLineId(), params.organizationId())
            .orElseThrow(() -> new ResourceNotFoundException("QuoteLine", params.quoteLineId()));

    if (!found.quote().getOrderId().equals(params.orderId())) {
      throw new InvalidStateException(
          "Quote line not in order",
          "Quote line " + params.quoteLineId() + " does not belong to order " + params.orderId());
    }
    if (missionRepository.existsByQuoteLineId(params.quoteLineId())) {
      throw new ResourceConflictException(
          "Mission already exists",
          "Quote line " + params.quoteLineId() + " already has a mission");
    }

    VehicleCategory category =
        vehicleCategoryRepository
            .findByIdAndOrganizationId(params.vehicleCategoryId(), params.organizationId())
            .orElseThrow(
                () -> new ResourceNotFoundException("VehicleCategory", params.vehicleCategoryId()));
    Order order = requireOrder(params.orderId(), params.organizationId());

    PreparedMission prepared =
        fieldResolver.resolveManual(
            order,
            found.quote(),
            found.line(),
            params.startAt(),
            category.getId(),
            category.getName(),
            params.notes());
    List<Mission> created = writer.insertAll(List.of(prepared), SpawnOrigin.MANUAL);
    if (created.isEmpty()) {
      throw new ResourceConflictException(
          "Mission already exists",
          "Quote line " + params.quoteLineId() + " was spawned concurrently");
    }

    Mission mission = created.get(0);
    log.info(
        "Manually spawned mission {} from line {} of order {}",
        mission.getId(),
        params.quoteLineId(),
        params.orderId());
    return mission;
  }

  /**
   * Creates a non-billable mission attached to the order's oldest quote but to no quote line.
   *
   * @throws ResourceNotFoundException if the order does not exist in the organization
   * @throws InvalidStateException if the order has no quote
   */
  public Mission createInternal(CreateInternalParams params) {
    Order order = requireOrder(params.orderId(), params.organizationId());
    Quote quote =
        quoteRepository
            .findFirstByOrderIdAndOrganizationIdOrderByCreatedAtAsc(
                params.orderId(), params.organizationId())
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Order has no quote",
                        "Order "
                            + params.orderId()
                            + " has no quote to attach an internal mission to"));

    String categoryName = null;
    if (params.vehicleCategoryId() != null) {
      categoryName =
          vehicleCategoryRepository
              .findByIdAndOrganizationId(params.vehicleCategoryId(), params.organizationId())
              .map(VehicleCategory::getName)
              .orElse(null);
    }

    PreparedMission prepared =
        fieldResolver.resolveInternal(
            order,
            quote,
            params.label(),
            params.startAt(),
            params.vehicleCategoryId(),
            categoryName,
            params.notes());
    List<Mission> created = writer.insertAll(List.of(prepared), SpawnOrigin.INTERNAL);
    if (created.isEmpty()) {
      throw new IllegalStateException("Internal mission " + prepared.id() + " was not written");
    }

    Mission mission = created.get(0);
    log.info("Created internal mission {} for order {}", mission.getId(), params.orderId());
    return mission;
  }

  @Transactional(readOnly = true)
  public boolean hasMissions(UUID orderId, String organizationId) {
    return missionRepository.existsByOrderIdAndOrganizationId(orderId, organizationId);
  }

  /** Number of CALCULATED lines in the order's spawnable quotes; 0 for an unknown order. */
  @Transactional(readOnly = true)
  public int getEligibleLineCount(UUID orderId, String organizationId) {
    return Math.toIntExact(
        quoteLineRepository.countCalculatedLines(orderId, organizationId, TripType.spawnable()));
  }

  public Set<TripType> getSpawnableTripTypes() {
    return TripType.spawnable();
  }

  /**
   * @throws ResourceNotFoundException if the order does not exist in {@code organizationId}
   */
  @Transactional(readOnly = true)
  public List<Mission> listMissions(UUID orderId, String organizationId) {
    requireOrder(orderId, organizationId);
    return missionRepository.findByOrder(orderId, organizationId);
  }

  private Order requireOrder(UUID orderId, String organizationId) {
    return orderRepository
        .findByIdAndOrganizationId(orderId, organizationId)
        .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
  }

  private void publishSkippedGroups(Order order, List<CollectedLines.SkippedGroup> skipped) {
    for (CollectedLines.SkippedGroup group : skipped) {
      eventPublisher.publishEvent(
          new SpawnGroupSkippedEvent(
              group.group().getId(),
              group.group().getLabel(),
              order.getId(),
              group.quote().getId(),
              group.reason(),
              group.detail(),
              order.getOrganizationId(),
              clock.instant()));
    }
  }
}
