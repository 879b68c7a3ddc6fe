package com.scaffold.backend.modules.organization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.support.AbstractPostgresIntegrationTest;
import com.scaffold.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class OrganizationIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "password123";
    private static final String ORGANIZATION_JSON = """
            {
              "customerId": "acme",
              "name": "Acme Corp",
              "description": "Pilot tenant",
              "theme": {
                "id": "acme-blue",
                "name": "Acme Blue",
                "light": {"background": "#ffffff", "primary": "#0044ff"},
                "dark": {"background": "#000000", "primary": "#3366ff"},
                "radius": "0.5rem"
              }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    private String adminToken;
    private String userToken;
    private UserAccount member;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureUser("admin@example.com", PASSWORD, "admin");
        member = testUserFactory.ensureUser("user@example.com", PASSWORD, "user");
        adminToken = accessToken("admin@example.com");
        userToken = accessToken("user@example.com");
    }

    @Test
    void adminCreatesOrganizationAndThemeIsPublic() throws Exception {
        UUID id = createOrganization();

        mockMvc.perform(get("/v1/themes/customer/{customerId}", "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.customerId").value("acme"))
                .andExpect(jsonPath("$.customerName").value("Acme Corp"))
                .andExpect(jsonPath("$.theme.light.primary").value("#0044ff"))
                .andExpect(jsonPath("$.theme.dark.background").value("#000000"))
                .andExpect(jsonPath("$.theme.radius").value("0.5rem"));

        mockMvc.perform(get("/organizations/{id}", id).header("Authorization", bearer(userToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.customerId").value("acme"));
    }

    @Test
    void themeLookupReportsMissingOrganizationAndMissingTheme() throws Exception {
        mockMvc.perform(get("/v1/themes/customer/{customerId}", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ORGANIZATION_NOT_FOUND"));

        mockMvc.perform(
                        post("/organizations")
                                .header("Authorization", bearer(adminToken))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"customerId": "plain", "name": "Plain Inc"}
                                        """)
                )
                .andExpect(status().isCreated());

        mockMvc.perform(get("/v1/themes/customer/{customerId}", "plain"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("THEME_NOT_CONFIGURED"));
    }

    @Test
    void duplicateCustomerIdConflicts() throws Exception {
        createOrganization();

        mockMvc.perform(
                        post("/organizations")
                                .header("Authorization", bearer(adminToken))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(ORGANIZATION_JSON)
                )
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ORGANIZATION_ALREADY_EXISTS"));
    }

    @Test
    void themeWithoutLightPaletteIsRejected() throws Exception {
        mockMvc.perform(
                        post("/organizations")
                                .header("Authorization", bearer(adminToken))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"customerId": "acme", "name": "Acme", "theme": {"name": "Broken"}}
                                        """)
                )
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void nonAdminCannotMutateOrganizations() throws Exception {
        mockMvc.perform(
                        post("/organizations")
                                .header("Authorization", bearer(userToken))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(ORGANIZATION_JSON)
                )
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCESS_DENIED"));

        mockMvc.perform(get("/organizations"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void adminManagesMembershipAndLifecycle() throws Exception {
        UUID id = createOrganization();

        mockMvc.perform(post("/organizations/{id}/members/{userId}", id, member.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memberIds[0]").value(member.getId().toString()));

        mockMvc.perform(post("/organizations/{id}/members/{userId}", id, member.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_MEMBER"));

        MvcResult listed = mockMvc.perform(get("/organizations").header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode organizations = objectMapper.readTree(listed.getResponse().getContentAsString());
        assertThat(organizations).hasSize(1);
        assertThat(organizations.get(0).path("memberIds").get(0).asText()).isEqualTo(member.getId().toString());

        mockMvc.perform(delete("/organizations/{id}/members/{userId}", id, member.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memberIds.length()").value(0));

        mockMvc.perform(
                        patch("/organizations/{id}", id)
                                .header("Authorization", bearer(adminToken))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"name": "Acme Holdings", "isActive": false}
                                        """)
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Acme Holdings"))
                .andExpect(jsonPath("$.isActive").value(false))
                .andExpect(jsonPath("$.theme.name").value("Acme Blue"));

        mockMvc.perform(delete("/organizations/{id}", id).header("Authorization", bearer(adminToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/organizations/{id}", id).header("Authorization", bearer(adminToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ORGANIZATION_NOT_FOUND"));
    }

    private UUID createOrganization() throws Exception {
        MvcResult result = mockMvc.perform(
                        post("/organizations")
                                .header("Authorization", bearer(adminToken))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(ORGANIZATION_JSON)
                )
                .andExpect(status().isCreated())
                .andExpect(header().exists("Location"))
                .andReturn();
        return UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString()).path("id").asText());
    }

    private String accessToken(String email) throws Exception {
        MvcResult result = mockMvc.perform(
                        post("/auth/login")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"email": "%s", "password": "%s"}
                                        """.formatted(email, PASSWORD))
                )
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("accessToken").asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
