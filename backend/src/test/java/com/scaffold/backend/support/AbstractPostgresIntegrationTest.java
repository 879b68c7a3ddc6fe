package com.scaffold.backend.support;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway migrates and seeds
 * the schema on context start; user data is wiped after each test, seeded roles are kept.
 */
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("scaffold_test")
            .withUsername("scaffold")
            .withPassword("scaffold");

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @AfterEach
    void resetData() {
        jdbcTemplate.execute("TRUNCATE user_organizations, organizations, refresh_tokens, user_roles, users, products RESTART IDENTITY CASCADE");
        jdbcTemplate.update("DELETE FROM roles WHERE name NOT IN ('admin', 'moderator', 'user')");
        jdbcTemplate.update("""
                DELETE FROM permissions
                 WHERE resource NOT IN ('products', 'users')
                    OR action NOT IN ('read', 'create', 'update', 'delete')
                """);
    }
}
