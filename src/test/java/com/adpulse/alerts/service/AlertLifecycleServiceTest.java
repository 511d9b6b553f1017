package com.adpulse.alerts.service;

import com.adpulse.alerts.config.MetricsConfig;
import com.adpulse.alerts.exception.NotFoundException;
import com.adpulse.alerts.exception.PermissionDeniedException;
import com.adpulse.alerts.exception.PreconditionException;
import com.adpulse.alerts.exception.ValidationException;
import com.adpulse.alerts.model.*;
import com.adpulse.alerts.testutil.InMemoryAlertStore;
import com.adpulse.alerts.testutil.MutableClock;
import com.adpulse.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertLifecycleServiceTest {

    private static final String OWNER = "manager-1";
    private static final String OTHER = "manager-2";

    @Mock private MetricsConfig metricsConfig;

    private InMemoryAlertStore store;
    private MutableClock clock;
    private AlertLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore();
        clock = new MutableClock(Instant.parse("2026-10-12T11:00:00Z"));
        lifecycleService = new AlertLifecycleService(store, metricsConfig, clock);
    }

    private Alert stored(String id, AlertStatus status) {
        return store.put(TestDataFactory.createAlert(id, OWNER, status).toBuilder()
                .createdAt(clock.millis() - 1_000)
                .build());
    }

    @Test
    void delete_activeAlert_failsWithPrecondition() {
        stored("a1", AlertStatus.ACTIVE);

        assertThatThrownBy(() -> lifecycleService.delete(OWNER, "a1"))
                .isInstanceOf(PreconditionException.class);
        assertThat(store.findById("a1")).isPresent();
    }

    @Test
    void delete_resolvedAlert_succeeds() {
        stored("a1", AlertStatus.RESOLVED);

        lifecycleService.delete(OWNER, "a1");

        assertThat(store.findById("a1")).isEmpty();
    }

    @Test
    void delete_dismissedAlert_succeeds() {
        stored("a1", AlertStatus.DISMISSED);

        lifecycleService.delete(OWNER, "a1");

        assertThat(store.findById("a1")).isEmpty();
    }

    @Test
    void anyOperation_otherOwner_isDenied() {
        stored("a1", AlertStatus.RESOLVED);

        assertThatThrownBy(() -> lifecycleService.delete(OTHER, "a1"))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> lifecycleService.markAsRead(OTHER, "a1"))
                .isInstanceOf(PermissionDeniedException.class);
        assertThat(store.findById("a1")).isPresent();
    }

    @Test
    void anyOperation_missingAlert_isNotFound() {
        assertThatThrownBy(() -> lifecycleService.acknowledge(OWNER, "missing"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void anyOperation_blankIds_areRejected() {
        assertThatThrownBy(() -> lifecycleService.resolve(OWNER, ""))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> lifecycleService.markAllAsRead(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void markAsRead_setsReadAtAndUpdatedAt() {
        stored("a1", AlertStatus.ACTIVE);

        Alert alert = lifecycleService.markAsRead(OWNER, "a1");

        assertThat(alert.isRead()).isTrue();
        assertThat(alert.getReadAt()).isEqualTo(clock.millis());
        assertThat(alert.getUpdatedAt()).isEqualTo(clock.millis());
    }

    @Test
    void markAsRead_alreadyRead_keepsOriginalReadAt() {
        store.put(TestDataFactory.createAlert("a1", OWNER, AlertStatus.ACTIVE).toBuilder().read(true).readAt(42L).build());

        Alert alert = lifecycleService.markAsRead(OWNER, "a1");

        assertThat(alert.getReadAt()).isEqualTo(42L);
    }

    @Test
    void markAllAsRead_onlyTouchesOwnersUnreadAlerts() {
        stored("a1", AlertStatus.ACTIVE);
        stored("a2", AlertStatus.ACKNOWLEDGED);
        store.put(TestDataFactory.createAlert("b1", OTHER, AlertStatus.ACTIVE));

        int changed = lifecycleService.markAllAsRead(OWNER);

        assertThat(changed).isEqualTo(2);
        assertThat(store.findById("b1").orElseThrow().isRead()).isFalse();
    }

    @Test
    void markMultipleAsRead_countsOnlyPreviouslyUnread() {
        stored("a1", AlertStatus.ACTIVE);
        store.put(TestDataFactory.createAlert("a2", OWNER, AlertStatus.ACTIVE).toBuilder().read(true).build());

        int changed = lifecycleService.markMultipleAsRead(OWNER, List.of("a1", "a2"));

        assertThat(changed).isEqualTo(1);
        assertThat(store.findById("a1").orElseThrow().isRead()).isTrue();
    }

    @Test
    void markMultipleAsRead_foreignIdInBatch_writesNothing() {
        stored("a1", AlertStatus.ACTIVE);
        store.put(TestDataFactory.createAlert("b1", OTHER, AlertStatus.ACTIVE));

        assertThatThrownBy(() -> lifecycleService.markMultipleAsRead(OWNER, List.of("a1", "b1")))
                .isInstanceOf(PermissionDeniedException.class);
        assertThat(store.findById("a1").orElseThrow().isRead()).isFalse();
    }

    @Test
    void acknowledge_activeAlert_alsoMarksRead() {
        stored("a1", AlertStatus.ACTIVE);

        Alert alert = lifecycleService.acknowledge(OWNER, "a1");

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alert.isRead()).isTrue();
        assertThat(alert.getReadAt()).isEqualTo(clock.millis());
        verify(metricsConfig).recordLifecycleTransition("ACKNOWLEDGED");
    }

    @Test
    void acknowledge_resolvedAlert_isRejected() {
        stored("a1", AlertStatus.RESOLVED);

        assertThatThrownBy(() -> lifecycleService.acknowledge(OWNER, "a1"))
                .isInstanceOf(PreconditionException.class);
    }

    @Test
    void resolve_setsResolvedAt() {
        stored("a1", AlertStatus.ACKNOWLEDGED);

        Alert alert = lifecycleService.resolve(OWNER, "a1");

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(alert.getResolvedAt()).isEqualTo(clock.millis());
    }

    @Test
    void dismiss_terminalAlert_isRejected() {
        stored("a1", AlertStatus.RESOLVED);

        assertThatThrownBy(() -> lifecycleService.dismiss(OWNER, "a1"))
                .isInstanceOf(PreconditionException.class);
        assertThat(store.findById("a1").orElseThrow().getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    void list_scopesToRecipientAndOrdersForInbox() {
        store.put(TestDataFactory.createAlert("a1", OWNER, AlertStatus.ACTIVE).toBuilder()
                .priority(AlertPriority.LOW).createdAt(300).build());
        store.put(TestDataFactory.createAlert("a2", OWNER, AlertStatus.ACTIVE).toBuilder()
                .priority(AlertPriority.CRITICAL).createdAt(100).build());
        store.put(TestDataFactory.createAlert("a3", OWNER, AlertStatus.ACTIVE).toBuilder()
                .priority(AlertPriority.CRITICAL).read(true).createdAt(500).build());
        store.put(TestDataFactory.createAlert("b1", OTHER, AlertStatus.ACTIVE));

        AlertFilter foreignFilter = AlertFilter.builder().recipientId(OTHER).build();
        AlertPage page = lifecycleService.list(OWNER, foreignFilter, new PageQuery(1, 2));

        assertThat(page.total()).isEqualTo(3);
        assertThat(page.totalPages()).isEqualTo(2);
        assertThat(page.alerts()).extracting(Alert::getId).containsExactly("a2", "a1");
    }

    @Test
    void list_filtersByStatusAndType() {
        stored("a1", AlertStatus.ACTIVE);
        stored("a2", AlertStatus.RESOLVED);
        store.put(TestDataFactory.createAlert("a3", OWNER, AlertStatus.ACTIVE).toBuilder().type(AlertType.BURN_RATE).build());

        AlertPage page = lifecycleService.list(OWNER,
                AlertFilter.builder().status(AlertStatus.ACTIVE).type(AlertType.ROAS_DROP).build(), null);

        assertThat(page.alerts()).extracting(Alert::getId).containsExactly("a1");
        assertThat(page.page()).isEqualTo(1);
    }

    @Test
    void stats_countsActiveUnreadAndTrailingWeek() {
        long now = clock.millis();
        store.put(TestDataFactory.createAlert("a1", OWNER, AlertStatus.ACTIVE).toBuilder()
                .priority(AlertPriority.CRITICAL).type(AlertType.BURN_RATE).createdAt(now - 1_000).build());
        store.put(TestDataFactory.createAlert("a2", OWNER, AlertStatus.ACTIVE).toBuilder()
                .priority(AlertPriority.HIGH).read(true).createdAt(now - Duration.ofDays(10).toMillis()).build());
        store.put(TestDataFactory.createAlert("a3", OWNER, AlertStatus.RESOLVED).toBuilder()
                .createdAt(now - 2_000).build());
        store.put(TestDataFactory.createAlert("b1", OTHER, AlertStatus.ACTIVE));

        AlertStats stats = lifecycleService.stats(OWNER);

        assertThat(stats.getTotalActive()).isEqualTo(2);
        assertThat(stats.getUnread()).isEqualTo(2);
        assertThat(stats.getLastWeek()).isEqualTo(2);
        assertThat(stats.getByPriority()).containsEntry(AlertPriority.CRITICAL, 1L).containsEntry(AlertPriority.HIGH, 1L);
        assertThat(stats.getByType()).containsOnlyKeys(AlertType.BURN_RATE);
        assertThat(stats.getByStatus()).containsEntry(AlertStatus.ACTIVE, 2L).containsEntry(AlertStatus.RESOLVED, 1L);
    }

    @Test
    void purgeResolved_removesOnlyOldTerminalAlerts() {
        long now = clock.millis();
        long old = now - Duration.ofDays(40).toMillis();
        store.put(TestDataFactory.createAlert("old-resolved", OWNER, AlertStatus.RESOLVED).toBuilder().createdAt(old).build());
        store.put(TestDataFactory.createAlert("old-active", OWNER, AlertStatus.ACTIVE).toBuilder().createdAt(old).build());
        store.put(TestDataFactory.createAlert("new-dismissed", OWNER, AlertStatus.DISMISSED).toBuilder().createdAt(now).build());

        int deleted = lifecycleService.purgeResolved(Duration.ofDays(30));

        assertThat(deleted).isEqualTo(1);
        assertThat(store.all()).extracting(Alert::getId).containsExactlyInAnyOrder("old-active", "new-dismissed");
    }
}
