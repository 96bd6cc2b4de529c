package fin.lending.intake.controller;

import com.jayway.jsonpath.JsonPath;
import fin.lending.intake.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP tests for the customer endpoints, authentication and error mapping
 */
@AutoConfigureMockMvc
@DisplayName("Customer API")
class CustomerControllerTest extends BaseIntegrationTest {

    private static final String TOKEN_HEADER = "x-access-token";
    private static final String TOKEN = "test-token";

    @Autowired
    private MockMvc mockMvc;

    private String createCustomerViaApi(String fullName, String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/customers")
                        .header(TOKEN_HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"" + fullName + "\",\"email\":\"" + email + "\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
    }

    @Test
    @DisplayName("Requests without a token are rejected")
    void testMissingToken() throws Exception {
        mockMvc.perform(get("/api/customers"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value(401))
                .andExpect(jsonPath("$.message").value("Authentication token is required"));
    }

    @Test
    void testWrongToken() throws Exception {
        mockMvc.perform(get("/api/customers").header(TOKEN_HEADER, "wrong"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid authentication token"));
    }

    @Test
    @DisplayName("Health endpoint is public")
    void testHealthIsPublic() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.database").value("up"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk());
    }

    @Test
    void testRequestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/health").header("X-Request-Id", "req-42"))
                .andExpect(header().string("X-Request-Id", "req-42"));
    }

    @Test
    void testCreateAndGet() throws Exception {
        String id = createCustomerViaApi("John Doe", "john@example.com");

        mockMvc.perform(get("/api/customers/{id}", id).header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(id))
                .andExpect(jsonPath("$.data.fullName").value("John Doe"))
                .andExpect(jsonPath("$.data.email").value("john@example.com"))
                .andExpect(jsonPath("$.data.createdAt", notNullValue()));
    }

    @Test
    @DisplayName("Invalid body lists every violated field")
    void testCreateValidation() throws Exception {
        mockMvc.perform(post("/api/customers")
                        .header(TOKEN_HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"J\",\"email\":\"nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].field").value("email"))
                .andExpect(jsonPath("$.data[1].field").value("fullName"));
    }

    @Test
    void testPaddedShortNameAndBadEmailAreBothReported() throws Exception {
        mockMvc.perform(post("/api/customers")
                        .header(TOKEN_HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"   a   \",\"email\":\"bad\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].field").value("email"))
                .andExpect(jsonPath("$.data[1].field").value("fullName"));
    }

    @Test
    void testDuplicateEmailIsConflict() throws Exception {
        createCustomerViaApi("John Doe", "john@example.com");

        mockMvc.perform(post("/api/customers")
                        .header(TOKEN_HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"Johnny\",\"email\":\"john@example.com\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
    }

    @Test
    @DisplayName("Malformed id is a validation failure")
    void testMalformedId() throws Exception {
        mockMvc.perform(get("/api/customers/not-a-uuid").header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data[0].field").value("customerId"))
                .andExpect(jsonPath("$.data[0].message").value("Invalid UUID format"));
    }

    @Test
    @DisplayName("Well-formed unknown id is not found")
    void testUnknownId() throws Exception {
        mockMvc.perform(get("/api/customers/{id}", UUID.randomUUID()).header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void testEmptyUpdate() throws Exception {
        String id = createCustomerViaApi("John Doe", "john@example.com");

        mockMvc.perform(patch("/api/customers/{id}", id)
                        .header(TOKEN_HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("At least one field must be provided for update"));
    }

    @Test
    void testUpdate() throws Exception {
        String id = createCustomerViaApi("John Doe", "john@example.com");

        mockMvc.perform(patch("/api/customers/{id}", id)
                        .header(TOKEN_HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"Jane Doe\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fullName").value("Jane Doe"))
                .andExpect(jsonPath("$.data.email").value("john@example.com"));
    }

    @Test
    void testUpdateToTakenEmail() throws Exception {
        createCustomerViaApi("Jane Doe", "jane@example.com");
        String id = createCustomerViaApi("John Doe", "john@example.com");

        mockMvc.perform(patch("/api/customers/{id}", id)
                        .header(TOKEN_HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"jane@example.com\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void testDelete() throws Exception {
        String id = createCustomerViaApi("John Doe", "john@example.com");

        mockMvc.perform(delete("/api/customers/{id}", id).header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/customers/{id}", id).header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isNotFound());
    }

    @Test
    void testListPaging() throws Exception {
        createCustomerViaApi("Customer A", "a@example.com");
        createCustomerViaApi("Customer B", "b@example.com");
        createCustomerViaApi("Customer C", "c@example.com");

        mockMvc.perform(get("/api/customers").param("page", "2").param("pageSize", "2")
                        .header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.items", hasSize(1)))
                .andExpect(jsonPath("$.data.total").value(3))
                .andExpect(jsonPath("$.data.page").value(2))
                .andExpect(jsonPath("$.data.pageSize").value(2))
                .andExpect(jsonPath("$.data.totalPages").value(2));
    }

    @Test
    @DisplayName("Largest page number returns an empty page")
    void testLargestPageNumber() throws Exception {
        createCustomerViaApi("John Doe", "john@example.com");

        mockMvc.perform(get("/api/customers").param("page", String.valueOf(Integer.MAX_VALUE))
                        .param("pageSize", "100")
                        .header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.items", hasSize(0)))
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.page").value(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Out-of-range and non-numeric paging parameters are rejected")
    void testInvalidPaging() throws Exception {
        mockMvc.perform(get("/api/customers").param("page", "0").param("pageSize", "101")
                        .header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].field").value("page"))
                .andExpect(jsonPath("$.data[1].field").value("pageSize"));

        mockMvc.perform(get("/api/customers").param("pageSize", "abc").header(TOKEN_HEADER, TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data[0].field").value("pageSize"))
                .andExpect(jsonPath("$.data[0].message").value("Invalid value: abc"));
    }
}
