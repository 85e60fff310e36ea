package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.mission.Mission;
import io.b2mash.transport.backoffice.mission.MissionRepository;
import io.b2mash.transport.backoffice.mission.MissionStatus;
import io.b2mash.transport.backoffice.mission.event.MissionSpawnedEvent;
import io.b2mash.transport.backoffice.mission.event.SpawnOrigin;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import tools.jackson.databind.ObjectMapper;

/**
 * Inserts prepared missions in one transaction. A row whose {@code (quote_line_id, dedupe_slot)}
 * already exists is skipped instead of failing the batch, which absorbs a concurrent run of the
 * same order. One {@link MissionSpawnedEvent} is published per inserted row, inside the
 * transaction.
 */
@Repository
public class MissionBulkWriter {

  private static final Logger log = LoggerFactory.getLogger(MissionBulkWriter.class);

  private static final String INSERT_MISSION =
      """
      INSERT INTO missions
          (id, organization_id, order_id, quote_id, quote_line_id, dedupe_slot, ref, status,
           start_at, end_at, is_internal, notes, source_data, created_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?)
      ON CONFLICT (quote_line_id, dedupe_slot) DO NOTHING
      RETURNING id
      """;

  private final JdbcClient jdbc;
  private final TransactionTemplate txTemplate;
  private final MissionRepository missionRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public MissionBulkWriter(
      JdbcClient jdbc,
      PlatformTransactionManager txManager,
      MissionRepository missionRepository,
      ApplicationEventPublisher eventPublisher,
      ObjectMapper objectMapper,
      Clock clock) {
    this.jdbc = jdbc;
    this.txTemplate = new TransactionTemplate(txManager);
    this.missionRepository = missionRepository;
    this.eventPublisher = eventPublisher;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Writes {@code missions} and returns the rows this call created, ordered by start time. Rows
   * skipped as duplicates are not returned. Any other failure rolls the whole batch back.
   */
  public List<Mission> insertAll(List<PreparedMission> missions, SpawnOrigin origin) {
    if (missions.isEmpty()) {
      return List.of();
    }

    List<UUID> insertedIds =
        txTemplate.execute(
            status -> {
              Instant now = clock.instant();
              var ids = new ArrayList<UUID>();
              for (PreparedMission mission : missions) {
                Optional<UUID> inserted = insert(mission, now);
                if (inserted.isPresent()) {
                  ids.add(inserted.get());
                  eventPublisher.publishEvent(toEvent(mission, origin, now));
                } else {
                  log.debug(
                      "Mission for line {} slot {} already exists, skipping",
                      mission.quoteLineId(),
                      mission.dedupeSlot());
                }
              }
              return ids;
            });

    if (insertedIds == null || insertedIds.isEmpty()) {
      return List.of();
    }
    if (insertedIds.size() < missions.size()) {
      log.info(
          "Inserted {} of {} missions, {} already existed",
          insertedIds.size(),
          missions.size(),
          missions.size() - insertedIds.size());
    }

    UUID orderId = missions.get(0).orderId();
    List<UUID> attemptedLineIds =
        missions.stream()
            .map(PreparedMission::quoteLineId)
            .filter(Objects::nonNull)
            .distinct()
            .toList();
    if (attemptedLineIds.isEmpty()) {
      return missionRepository.findByIdsOrderByStartAt(insertedIds);
    }
    return missionRepository.findCreated(orderId, attemptedLineIds, insertedIds);
  }

  private Optional<UUID> insert(PreparedMission mission, Instant now) {
    return jdbc.sql(INSERT_MISSION)
        .params(
            mission.id(),
            mission.organizationId(),
            mission.orderId(),
            mission.quoteId(),
            mission.quoteLineId(),
            mission.dedupeSlot(),
            mission.ref(),
            MissionStatus.PENDING.name(),
            Timestamp.from(mission.startAt()),
            toTimestamp(mission.endAt()),
            mission.internal(),
            mission.notes(),
            objectMapper.writeValueAsString(mission.sourceData()),
            Timestamp.from(now))
        .query(UUID.class)
        .optional();
  }

  private static MissionSpawnedEvent toEvent(
      PreparedMission mission, SpawnOrigin origin, Instant occurredAt) {
    return new MissionSpawnedEvent(
        mission.id(),
        mission.ref(),
        mission.orderId(),
        mission.quoteId(),
        mission.quoteLineId(),
        mission.groupLineId(),
        mission.startAt(),
        origin,
        mission.organizationId(),
        occurredAt);
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }
}
