package com.flagship.wager_engine.support;

import com.flagship.wager_engine.game.OutcomeGenerator;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.verification.ExternalLedgerClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Shared setup of the integration tests: one PostgreSQL container for the whole run, the
 * external ledger and the outcome generator mocked, and round timers driven by hand.
 *
 * Tests isolate themselves by using fresh player addresses instead of cleaning tables.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(IntegrationTestBase.ManualTimerConfig.class)
public abstract class IntegrationTestBase {

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wager_engine_test")
            .withUsername("test")
            .withPassword("test");

    static {
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @MockBean
    protected ExternalLedgerClient externalLedgerClient;

    @MockBean
    protected OutcomeGenerator outcomeGenerator;

    @Autowired
    protected LedgerService ledgerService;

    @Autowired
    protected ManualRoundTimer timer;

    protected static final String HOUSE = "HOUSEADDRESSHOUSEADDRESSHOUSEADDRESSHOUSEADDRESSHOUSEAD";

    /**
     * A player address nobody else uses.
     */
    protected static String newPlayer() {
        String raw = (UUID.randomUUID().toString() + UUID.randomUUID()).replace("-", "").toUpperCase();
        return raw.substring(0, 55);
    }

    protected String fundedPlayer(String balance) {
        String player = newPlayer();
        ledgerService.credit(player, new BigDecimal(balance));
        return player;
    }

    protected static void assertAmount(String expected, BigDecimal actual) {
        org.junit.jupiter.api.Assertions.assertEquals(0, new BigDecimal(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual);
    }

    @TestConfiguration
    static class ManualTimerConfig {

        @Bean
        @Primary
        ManualRoundTimer manualRoundTimer() {
            return new ManualRoundTimer();
        }
    }
}
