package io.b2mash.transport.backoffice.mission;

import io.b2mash.transport.backoffice.mission.dto.CreateInternalMissionRequest;
import io.b2mash.transport.backoffice.mission.dto.MissionResponse;
import io.b2mash.transport.backoffice.mission.dto.SpawnManualRequest;
import io.b2mash.transport.backoffice.mission.dto.SpawnPreviewResponse;
import io.b2mash.transport.backoffice.mission.dto.SpawnResultResponse;
import io.b2mash.transport.backoffice.mission.spawn.CreateInternalParams;
import io.b2mash.transport.backoffice.mission.spawn.SpawnManualParams;
import io.b2mash.transport.backoffice.mission.spawn.SpawnService;
import io.b2mash.transport.backoffice.multitenancy.TenantContext;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders/{orderId}/missions")
public class MissionController {

  private final SpawnService spawnService;

  public MissionController(SpawnService spawnService) {
    this.spawnService = spawnService;
  }

  @GetMapping
  public ResponseEntity<List<MissionResponse>> listMissions(@PathVariable UUID orderId) {
    String organizationId = TenantContext.requireOrganizationId();
    return ResponseEntity.ok(
        spawnService.listMissions(orderId, organizationId).stream()
            .map(MissionResponse::from)
            .toList());
  }

  @GetMapping("/preview")
  public ResponseEntity<SpawnPreviewResponse> preview(@PathVariable UUID orderId) {
    String organizationId = TenantContext.requireOrganizationId();
    return ResponseEntity.ok(
        new SpawnPreviewResponse(
            spawnService.hasMissions(orderId, organizationId),
            spawnService.getEligibleLineCount(orderId, organizationId),
            spawnService.getSpawnableTripTypes()));
  }

  @PostMapping("/spawn")
  public ResponseEntity<SpawnResultResponse> spawn(@PathVariable UUID orderId) {
    String organizationId = TenantContext.requireOrganizationId();
    var created =
        spawnService.execute(orderId, organizationId).stream().map(MissionResponse::from).toList();
    return ResponseEntity.ok(SpawnResultResponse.of(created));
  }

  @PostMapping("/manual")
  public ResponseEntity<MissionResponse> spawnManual(
      @PathVariable UUID orderId, @Valid @RequestBody SpawnManualRequest request) {
    String organizationId = TenantContext.requireOrganizationId();
    var mission =
        spawnService.spawnManual(
            new SpawnManualParams(
                request.quoteLineId(),
                orderId,
                organizationId,
                request.startAt(),
                request.vehicleCategoryId(),
                request.notes()));
    return created(orderId, MissionResponse.from(mission));
  }

  @PostMapping("/internal")
  public ResponseEntity<MissionResponse> createInternal(
      @PathVariable UUID orderId, @Valid @RequestBody CreateInternalMissionRequest request) {
    String organizationId = TenantContext.requireOrganizationId();
    var mission =
        spawnService.createInternal(
            new CreateInternalParams(
                orderId,
                organizationId,
                request.label(),
                request.startAt(),
                request.vehicleCategoryId(),
                request.notes()));
    return created(orderId, MissionResponse.from(mission));
  }

  private static ResponseEntity<MissionResponse> created(UUID orderId, MissionResponse response) {
    return ResponseEntity.created(
            URI.create("/api/orders/" + orderId + "/missions/" + response.id()))
        .body(response);
  }
}
