package com.checkmate.pos_sync.observability;

import com.checkmate.pos_sync.cash.CashCustomerResolver;
import com.checkmate.pos_sync.outbox.OutboxEventRepository;
import com.checkmate.pos_sync.roster.RosterAccount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthIndicatorsTest {

    @Nested
    @DisplayName("Outbox backlog")
    class OutboxBacklog {

        @Mock
        private OutboxEventRepository repository;

        private Health healthWithBacklog(long backlog) {
            when(repository.countUnpublished()).thenReturn(backlog);
            return new HealthIndicators.OutboxHealthIndicator(repository).health();
        }

        @Test
        @DisplayName("Small backlog is UP")
        void smallBacklog() {
            Health health = healthWithBacklog(12);

            assertEquals(Status.UP, health.getStatus());
            assertEquals(12L, health.getDetails().get("backlogSize"));
        }

        @Test
        @DisplayName("Backlog past the warning threshold is WARNING")
        void warningBacklog() {
            assertEquals("WARNING", healthWithBacklog(1000).getStatus().getCode());
        }

        @Test
        @DisplayName("Backlog past the critical threshold is DOWN")
        void criticalBacklog() {
            assertEquals(Status.DOWN, healthWithBacklog(10000).getStatus());
        }

        @Test
        @DisplayName("Unreachable database is DOWN")
        void databaseError() {
            when(repository.countUnpublished()).thenThrow(new IllegalStateException("connection refused"));

            Health health = new HealthIndicators.OutboxHealthIndicator(repository).health();

            assertEquals(Status.DOWN, health.getStatus());
            assertEquals("connection refused", health.getDetails().get("error"));
        }
    }

    @Nested
    @DisplayName("Cash placeholder account")
    class CashAccount {

        @Mock
        private CashCustomerResolver resolver;

        @Test
        @DisplayName("Configured placeholder is UP")
        void configured() {
            when(resolver.findPlaceholder()).thenReturn(Optional.of(
                    new RosterAccount(9L, 999999999L, null, "HS", null, null)));

            Health health = new HealthIndicators.CashAccountHealthIndicator(resolver).health();

            assertEquals(Status.UP, health.getStatus());
            assertEquals(999999999L, health.getDetails().get("externalId"));
        }

        @Test
        @DisplayName("Missing placeholder is DEGRADED, not DOWN")
        void missing() {
            when(resolver.findPlaceholder()).thenReturn(Optional.empty());

            Health health = new HealthIndicators.CashAccountHealthIndicator(resolver).health();

            assertEquals("DEGRADED", health.getStatus().getCode());
            assertEquals("CASH_STUDENT_NOT_CONFIGURED", health.getDetails().get("error"));
        }
    }
}
