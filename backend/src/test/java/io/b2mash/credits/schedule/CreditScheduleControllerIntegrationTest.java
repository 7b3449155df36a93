package io.b2mash.credits.schedule;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.credits.TestcontainersConfiguration;
import io.b2mash.credits.testutil.TestUsers;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CreditScheduleControllerIntegrationTest {

  private static final String BASE = "/api/credit-schedules";

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  // --- Create ---

  @Test
  void create_weeklySchedule_returnsCreated() throws Exception {
    mockMvc
        .perform(
            post(BASE + "/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "name": "Weekend boost",
                      "scheduleType": "weekly",
                      "startDate": "2024-01-01",
                      "executionTime": "10:00",
                      "daysOfWeek": [7, 6],
                      "targetingMode": "ALL_USERS",
                      "creditAmount": 3,
                      "creditType": "activity"
                    }
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().exists("Location"))
        .andExpect(jsonPath("$.scheduleType").value("WEEKLY"))
        .andExpect(jsonPath("$.daysOfWeek[0]").value(6))
        .andExpect(jsonPath("$.daysOfWeek[1]").value(7))
        .andExpect(jsonPath("$.maxUsersPerExecution").value(1000))
        .andExpect(jsonPath("$.active").value(true))
        .andExpect(jsonPath("$.nextFireAt").exists());
  }

  @Test
  void create_monthlyWithoutDay_returns400WithField() throws Exception {
    mockMvc
        .perform(
            post(BASE + "/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "name": "Broken monthly",
                      "scheduleType": "MONTHLY",
                      "startDate": "2024-01-01",
                      "targetingMode": "ALL_USERS",
                      "creditAmount": 25
                    }
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field").value("dayOfMonth"));
  }

  @Test
  void create_missingName_returns400() throws Exception {
    mockMvc
        .perform(
            post(BASE + "/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "scheduleType": "DAILY",
                      "startDate": "2024-01-01",
                      "targetingMode": "ALL_USERS",
                      "creditAmount": 1
                    }
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void create_amountFinerThanFourDecimals_returns400() throws Exception {
    mockMvc
        .perform(
            post(BASE + "/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "name": "Dust",
                      "scheduleType": "DAILY",
                      "startDate": "2024-01-01",
                      "targetingMode": "ALL_USERS",
                      "creditAmount": 0.00001
                    }
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field").value("creditAmount"));
  }

  @Test
  void create_withMaxCreditsPerUser_returnsIt() throws Exception {
    mockMvc
        .perform(
            post(BASE + "/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "name": "Capped daily",
                      "scheduleType": "DAILY",
                      "startDate": "2024-01-01",
                      "targetingMode": "ALL_USERS",
                      "creditAmount": 5,
                      "maxCreditsPerUser": 20
                    }
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.maxCreditsPerUser").value(20));
  }

  // --- Update, toggle, delete ---

  @Test
  void update_changesOnlyPatchedFields() throws Exception {
    var id = createDailyWelcome();

    mockMvc
        .perform(
            put(BASE + "/update/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"creditAmount\": 8, \"maxUsersPerExecution\": 20}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.creditAmount").value(8))
        .andExpect(jsonPath("$.maxUsersPerExecution").value(20))
        .andExpect(jsonPath("$.targetingMode").value("NEW_USERS"))
        .andExpect(jsonPath("$.maxDaysSinceRegistration").value(7));
  }

  @Test
  void toggle_withoutBody_flipsAndWithBodySets() throws Exception {
    var id = createDailyWelcome();

    mockMvc
        .perform(post(BASE + "/toggle/" + id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false))
        .andExpect(jsonPath("$.nextFireAt").doesNotExist());

    mockMvc
        .perform(
            post(BASE + "/toggle/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"active\": true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void delete_hidesScheduleFromReads() throws Exception {
    var id = createDailyWelcome();

    mockMvc.perform(delete(BASE + "/delete/" + id)).andExpect(status().isNoContent());

    mockMvc
        .perform(get(BASE + "/details/" + id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.resource").value("CreditSchedule"))
        .andExpect(jsonPath("$.key").value(id));
    mockMvc.perform(delete(BASE + "/delete/" + id)).andExpect(status().isNotFound());
  }

  // --- Reads ---

  @Test
  void list_filtersByStatus() throws Exception {
    var inactive = createDailyWelcome();
    mockMvc
        .perform(
            post(BASE + "/toggle/" + inactive)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"active\": false}"))
        .andExpect(status().isOk());

    mockMvc
        .perform(get(BASE + "/list").param("status", "inactive").param("size", "100"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content[?(@.id == '" + inactive + "')]").exists())
        .andExpect(jsonPath("$.content[?(@.active == true)]").isEmpty());
  }

  @Test
  void list_invalidPageSize_returns400() throws Exception {
    mockMvc.perform(get(BASE + "/list").param("size", "500")).andExpect(status().isBadRequest());
  }

  @Test
  void details_unknownSchedule_returns404() throws Exception {
    mockMvc
        .perform(get(BASE + "/details/" + UUID.randomUUID()))
        .andExpect(status().isNotFound());
  }

  @Test
  void analytics_invalidWindow_returns400() throws Exception {
    var id = createDailyWelcome();

    mockMvc
        .perform(get(BASE + "/analytics/" + id).param("days", "0"))
        .andExpect(status().isBadRequest());
  }

  // --- Templates ---

  @Test
  void templates_listsPresets() throws Exception {
    mockMvc
        .perform(get(BASE + "/templates"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(5)))
        .andExpect(jsonPath("$[0].key").value("daily_welcome"));
  }

  @Test
  void createFromTemplate_unknownTemplate_returns404() throws Exception {
    mockMvc
        .perform(
            post(BASE + "/create-from-template")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"templateName\": \"yearly_gift\"}"))
        .andExpect(status().isNotFound());
  }

  @Test
  void quickSetup_weeklyLoyalty_createsFridaySchedule() throws Exception {
    mockMvc
        .perform(
            post(BASE + "/quick-setup")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"setupType\": \"weekly_loyalty\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.daysOfWeek[0]").value(5))
        .andExpect(jsonPath("$.creditType").value("loyalty"))
        .andExpect(jsonPath("$.maxDaysSinceLastActivity").value(7));
  }

  // --- Execution and scheduler ---

  @Test
  void execute_manualRun_creditsEligibleUsers() throws Exception {
    TestUsers.clear(jdbcTemplate);
    TestUsers.insert(jdbcTemplate, "manual", 3, Duration.ofDays(1), null);
    var id = createDailyWelcome();

    mockMvc
        .perform(post(BASE + "/execute/" + id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.triggeredBy").value("MANUAL"))
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.usersCredited").value(3));

    mockMvc
        .perform(get(BASE + "/executions/" + id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)));
    mockMvc
        .perform(get(BASE + "/details/" + id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.schedule.totalUsersCredited").value(3))
        .andExpect(jsonPath("$.executionRunning").value(false));
    mockMvc
        .perform(get(BASE + "/analytics/" + id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalRuns").value(1))
        .andExpect(jsonPath("$.successfulRuns").value(1));
  }

  @Test
  void execute_inactiveSchedule_returns400() throws Exception {
    var id = createDailyWelcome();
    mockMvc
        .perform(
            post(BASE + "/toggle/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"active\": false}"))
        .andExpect(status().isOk());

    mockMvc
        .perform(post(BASE + "/execute/" + id))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Schedule inactive"))
        .andExpect(jsonPath("$.scheduleId").value(id));
  }

  @Test
  void scheduler_startStopLifecycle() throws Exception {
    mockMvc
        .perform(post(BASE + "/scheduler/start"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("RUNNING"));
    mockMvc
        .perform(post(BASE + "/scheduler/stop"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("STOPPED"));
    mockMvc.perform(post(BASE + "/scheduler/stop")).andExpect(status().isConflict());
  }

  @Test
  void dashboard_combinesSummaryAndSchedulerStatus() throws Exception {
    createDailyWelcome();

    mockMvc
        .perform(get(BASE + "/dashboard"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary.totalSchedules").value(greaterThanOrEqualTo(1)))
        .andExpect(jsonPath("$.scheduler.state").exists());
  }

  private String createDailyWelcome() throws Exception {
    var result =
        mockMvc
            .perform(
                post(BASE + "/create-from-template")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"templateName\": \"daily_welcome\"}"))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }
}
