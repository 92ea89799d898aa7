package com.library.lending;

import com.library.lending.integration.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

class LibraryLendingApplicationTests extends AbstractIntegrationTest {

    @Test
    void contextLoads() {
        // Verifies: Spring context starts, Testcontainers PostgreSQL spins up,
        // Flyway applies the schema migrations, Hibernate validates entity mappings.
    }
}
