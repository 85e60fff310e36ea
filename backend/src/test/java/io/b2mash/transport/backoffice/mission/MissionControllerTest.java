package io.b2mash.transport.backoffice.mission;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.transport.backoffice.TestcontainersConfiguration;
import io.b2mash.transport.backoffice.multitenancy.TenantFilter;
import io.b2mash.transport.backoffice.order.OrderRepository;
import io.b2mash.transport.backoffice.quote.QuoteLineRepository;
import io.b2mash.transport.backoffice.quote.QuoteLineType;
import io.b2mash.transport.backoffice.quote.QuoteRepository;
import io.b2mash.transport.backoffice.quote.TripType;
import io.b2mash.transport.backoffice.testsupport.OrderTestData;
import io.b2mash.transport.backoffice.vehicle.VehicleCategoryRepository;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@Testcontainers(disabledWithoutDocker = true)
class MissionControllerTest {

  private static final String ORG_ID = "org_mission_ctrl_test";
  private static final String OTHER_ORG_ID = "org_mission_ctrl_other";
  private static final String HEADER = TenantFilter.ORGANIZATION_HEADER;

  @Autowired private MockMvc mockMvc;
  @Autowired private OrderRepository orderRepository;
  @Autowired private QuoteRepository quoteRepository;
  @Autowired private QuoteLineRepository quoteLineRepository;
  @Autowired private VehicleCategoryRepository vehicleCategoryRepository;

  private UUID orderId;
  private String orderReference;
  private UUID emptyOrderId;
  private UUID vehicleCategoryId;
  private UUID transferLineId;
  private UUID parkingLineId;
  private UUID hiddenLineId;

  @BeforeAll
  void setup() {
    var data =
        new OrderTestData(
            orderRepository, quoteRepository, quoteLineRepository, vehicleCategoryRepository);
    var order = data.order(ORG_ID);
    orderId = order.getId();
    orderReference = order.getReference();
    emptyOrderId = data.order(ORG_ID).getId();
    vehicleCategoryId = data.vehicleCategory(ORG_ID, "Van").getId();

    var quote =
        data.quote(
            order, TripType.TRANSFER, Instant.parse("2026-09-12T07:45:00Z"), vehicleCategoryId);
    transferLineId = data.line(quote, QuoteLineType.CALCULATED, "Airport transfer", 0).getId();
    parkingLineId = data.line(quote, QuoteLineType.MANUAL, "Airport parking", 1).getId();
    hiddenLineId =
        data.line(quote, null, QuoteLineType.CALCULATED, "Meet and greet", 2, Map.of(), false)
            .getId();
  }

  @Test
  @Order(1)
  void preview_beforeConfirmation_reportsNoMissions() throws Exception {
    mockMvc
        .perform(get("/api/orders/{orderId}/missions/preview", orderId).header(HEADER, ORG_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.hasMissions").value(false))
        .andExpect(jsonPath("$.eligibleLineCount").value(2))
        .andExpect(jsonPath("$.spawnableTripTypes", containsInAnyOrder("TRANSFER", "DISPO")));
  }

  @Test
  @Order(2)
  void transitionToQuoted_spawnsNothing() throws Exception {
    mockMvc
        .perform(
            patch("/api/orders/{orderId}/status", orderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"QUOTED\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("QUOTED"))
        .andExpect(jsonPath("$.spawnedMissions.length()").value(0));
  }

  @Test
  @Order(3)
  void transitionToConfirmed_spawnsMissions() throws Exception {
    mockMvc
        .perform(
            patch("/api/orders/{orderId}/status", orderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"CONFIRMED\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CONFIRMED"))
        .andExpect(jsonPath("$.spawnedMissions.length()").value(1))
        .andExpect(jsonPath("$.spawnedMissions[0].ref").value(orderReference + "-01"))
        .andExpect(jsonPath("$.spawnedMissions[0].quoteLineId").value(transferLineId.toString()))
        .andExpect(jsonPath("$.spawnedMissions[0].status").value("PENDING"))
        .andExpect(jsonPath("$.spawnedMissions[0].sourceData.vehicleCategoryName").value("Van"));
  }

  @Test
  @Order(4)
  void invalidTransition_returns400() throws Exception {
    mockMvc
        .perform(
            patch("/api/orders/{orderId}/status", orderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"DRAFT\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(5)
  void listAndPreview_afterConfirmation() throws Exception {
    mockMvc
        .perform(get("/api/orders/{orderId}/missions", orderId).header(HEADER, ORG_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].orderId").value(orderId.toString()));

    mockMvc
        .perform(get("/api/orders/{orderId}/missions/preview", orderId).header(HEADER, ORG_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.hasMissions").value(true));
  }

  @Test
  @Order(6)
  void spawnAgain_createsNothing() throws Exception {
    mockMvc
        .perform(post("/api/orders/{orderId}/missions/spawn", orderId).header(HEADER, ORG_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.createdCount").value(0))
        .andExpect(jsonPath("$.missions.length()").value(0));
  }

  @Test
  @Order(7)
  void spawnManual_createsMissionOnceForLine() throws Exception {
    String body =
        """
        {"quoteLineId": "%s", "startAt": "2026-09-12T07:00:00Z",
         "vehicleCategoryId": "%s", "notes": "Book short-stay parking"}
        """
            .formatted(parkingLineId, vehicleCategoryId);

    var result =
        mockMvc
            .perform(
                post("/api/orders/{orderId}/missions/manual", orderId)
                    .header(HEADER, ORG_ID)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.quoteLineId").value(parkingLineId.toString()))
            .andExpect(jsonPath("$.notes").value("Book short-stay parking"))
            .andExpect(jsonPath("$.sourceData.manuallySpawned").value(true))
            .andExpect(jsonPath("$.sourceData.lineType").value("MANUAL"))
            .andReturn();
    String missionId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            post("/api/orders/{orderId}/missions/manual", orderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("conflict"));

    mockMvc
        .perform(get("/api/orders/{orderId}/missions", orderId).header(HEADER, ORG_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[*].id", hasItem(missionId)));
  }

  @Test
  @Order(8)
  void spawnManual_unknownVehicleCategory_returns404() throws Exception {
    mockMvc
        .perform(
            post("/api/orders/{orderId}/missions/manual", orderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"quoteLineId": "%s", "startAt": "2026-09-12T08:00:00Z",
                     "vehicleCategoryId": "%s"}
                    """
                        .formatted(hiddenLineId, UUID.randomUUID())))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("not_found"))
        .andExpect(jsonPath("$.title").value("VehicleCategory not found"));
  }

  @Test
  @Order(9)
  void spawnManual_missingFields_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/orders/{orderId}/missions/manual", orderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quoteLineId\": \"%s\"}".formatted(hiddenLineId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(10)
  void createInternal_returns201() throws Exception {
    mockMvc
        .perform(
            post("/api/orders/{orderId}/missions/internal", orderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"label": "Reposition van", "startAt": "2026-09-12T06:00:00Z",
                     "vehicleCategoryId": "%s"}
                    """
                        .formatted(vehicleCategoryId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.quoteLineId").doesNotExist())
        .andExpect(jsonPath("$.sourceData.isInternal").value(true))
        .andExpect(jsonPath("$.sourceData.label").value("Reposition van"))
        .andExpect(jsonPath("$.sourceData.vehicleCategoryName").value("Van"));
  }

  @Test
  @Order(11)
  void createInternal_orderWithoutQuote_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/orders/{orderId}/missions/internal", emptyOrderId)
                .header(HEADER, ORG_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"label\": \"Wash car\", \"startAt\": \"2026-09-12T06:00:00Z\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(12)
  void spawnAudit_listsSpawnedMissions() throws Exception {
    mockMvc
        .perform(get("/api/orders/{orderId}/spawn-audit", orderId).header(HEADER, ORG_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].eventType", hasItem("mission.spawned")))
        .andExpect(jsonPath("$[*].eventType", hasItem("order.status_changed")))
        .andExpect(jsonPath("$[0].orderId").value(orderId.toString()));
  }

  @Test
  @Order(13)
  void missingOrganizationHeader_returns401() throws Exception {
    mockMvc
        .perform(get("/api/orders/{orderId}/missions", orderId))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("missing_organization"));
  }

  @Test
  @Order(14)
  void otherOrganization_cannotSeeOrder() throws Exception {
    mockMvc
        .perform(get("/api/orders/{orderId}/missions", orderId).header(HEADER, OTHER_ORG_ID))
        .andExpect(status().isNotFound());

    mockMvc
        .perform(post("/api/orders/{orderId}/missions/spawn", orderId).header(HEADER, OTHER_ORG_ID))
        .andExpect(status().isNotFound());
  }

  @Test
  @Order(15)
  void malformedOrganizationHeader_returns400() throws Exception {
    mockMvc
        .perform(get("/api/orders/{orderId}/missions", orderId).header(HEADER, "org id; drop"))
        .andExpect(status().isBadRequest());
  }
}
