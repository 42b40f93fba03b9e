package com.kyper.storefront.service.order;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyper.storefront.exception.InsufficientStockException;
import com.kyper.storefront.exception.OrderValidationException;
import com.kyper.storefront.exception.PoolExhaustedException;
import com.kyper.storefront.infrastructure.cache.RedisCacheService;
import com.kyper.storefront.infrastructure.messaging.OrderEventPublisher;
import com.kyper.storefront.infrastructure.messaging.events.OrderPlacedEvent;
import com.kyper.storefront.infrastructure.metrics.StorefrontMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.sql.SQLTransientConnectionException;
import java.util.Collection;

import static com.kyper.storefront.testutil.TestDataBuilder.address;
import static com.kyper.storefront.testutil.TestDataBuilder.order;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderSubmissionEngine.
 * The transaction executor is real and drives a mocked transaction manager, so
 * commit and rollback are observable.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderSubmissionEngine Unit Tests")
class OrderSubmissionEngineTest {

    @Mock
    private OrderSubmissionValidator validator;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private OrderStore orderStore;

    @Mock
    private InventoryLedger inventoryLedger;

    @Mock
    private RedisCacheService cacheService;

    @Mock
    private OrderEventPublisher eventPublisher;

    @Mock
    private StorefrontMetricsService metricsService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SimpleTransactionStatus transactionStatus;

    private OrderSubmissionEngine engine;

    @BeforeEach
    void setUp() {
        transactionStatus = new SimpleTransactionStatus();
        engine = new OrderSubmissionEngine(
                validator,
                new OrderTransactionExecutor(transactionManager, 10),
                orderStore,
                inventoryLedger,
                objectMapper,
                cacheService,
                eventPublisher,
                metricsService
        );
    }

    // ========================================
    // submit() - success
    // ========================================

    @Test
    @DisplayName("submit - Success: writes header, then item and decrement per line, then commits")
    void submit_Success_WritesInPayloadOrderAndCommits() throws Exception {
        // Given
        OrderSubmission submission = order()
                .userId(7L)
                .total(new BigDecimal("50.00"))
                .shippingAddress(address("Calle Mayor 1", "Madrid"))
                .item(1L, 2, "10.00")
                .item(2L, 1, "30.00")
                .build();
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(orderStore.insertOrder(eq(7L), eq(new BigDecimal("50.00")), anyString(), eq("pending"))).thenReturn(100L);

        // When
        SubmittedOrder result = engine.submit(submission);

        // Then
        assertThat(result.getOrderId()).isEqualTo(100L);
        assertThat(result.getStatus()).isEqualTo("pending");
        assertThat(result.getTotal()).isEqualByComparingTo("50.00");
        assertThat(result.getItemCount()).isEqualTo(2);

        InOrder inOrder = inOrder(transactionManager, orderStore, inventoryLedger, cacheService, eventPublisher);
        inOrder.verify(transactionManager).getTransaction(any());
        inOrder.verify(orderStore).insertOrder(eq(7L), any(), anyString(), eq("pending"));
        inOrder.verify(orderStore).insertLineItem(100L, 1L, 2, new BigDecimal("10.00"));
        inOrder.verify(inventoryLedger).decrementStock(1L, 2);
        inOrder.verify(orderStore).insertLineItem(100L, 2L, 1, new BigDecimal("30.00"));
        inOrder.verify(inventoryLedger).decrementStock(2L, 1);
        inOrder.verify(transactionManager).commit(transactionStatus);
        inOrder.verify(cacheService).evictProducts(any());
        inOrder.verify(eventPublisher).publishOrderPlaced(any());

        verify(transactionManager, never()).rollback(any());
        verify(metricsService).recordOrderSubmitted(2);
        verify(metricsService).recordSubmissionLatency(anyLong());
    }

    @Test
    @DisplayName("submit - Shipping address is stored as the client's JSON")
    void submit_SerializesShippingAddressVerbatim() throws Exception {
        // Given
        OrderSubmission submission = order().item(1L, 1, "50.00").build();
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(orderStore.insertOrder(any(), any(), anyString(), anyString())).thenReturn(1L);
        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);

        // When
        engine.submit(submission);

        // Then
        verify(orderStore).insertOrder(isNull(), any(), stored.capture(), eq("pending"));
        assertThat(objectMapper.readTree(stored.getValue())).isEqualTo(submission.getShippingAddress());
    }

    @Test
    @DisplayName("submit - Explicit status is kept, trimmed")
    void submit_ExplicitStatus_Kept() {
        // Given
        OrderSubmission submission = order().status(" paid ").item(1L, 1, "50.00").build();
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(orderStore.insertOrder(any(), any(), anyString(), eq("paid"))).thenReturn(3L);

        // When
        SubmittedOrder result = engine.submit(submission);

        // Then
        assertThat(result.getStatus()).isEqualTo("paid");
    }

    @Test
    @DisplayName("submit - After commit, each product cache entry is evicted once and the event carries the order")
    @SuppressWarnings("unchecked")
    void submit_AfterCommit_EvictsDistinctProductsAndPublishes() {
        // Given
        OrderSubmission submission = order()
                .userId(4L)
                .item(1L, 1, "10.00")
                .item(1L, 2, "10.00")
                .item(3L, 1, "20.00")
                .build();
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(orderStore.insertOrder(any(), any(), anyString(), anyString())).thenReturn(55L);
        ArgumentCaptor<Collection<Long>> evicted = ArgumentCaptor.forClass(Collection.class);
        ArgumentCaptor<OrderPlacedEvent> event = ArgumentCaptor.forClass(OrderPlacedEvent.class);

        // When
        engine.submit(submission);

        // Then
        verify(cacheService).evictProducts(evicted.capture());
        assertThat(evicted.getValue()).containsExactly(1L, 3L);

        verify(eventPublisher).publishOrderPlaced(event.capture());
        assertThat(event.getValue().getOrderId()).isEqualTo(55L);
        assertThat(event.getValue().getUserId()).isEqualTo(4L);
        assertThat(event.getValue().getItems()).hasSize(3);
    }

    // ========================================
    // submit() - failures
    // ========================================

    @Test
    @DisplayName("submit - Validation failure touches neither the pool nor storage")
    void submit_ValidationFailure_NoStorageInteraction() {
        // Given
        OrderSubmission submission = order().build();
        doThrow(new OrderValidationException("items", "Order must contain at least one item"))
                .when(validator).validate(submission);

        // When / Then
        assertThatThrownBy(() -> engine.submit(submission))
                .isInstanceOf(OrderValidationException.class);

        verifyNoInteractions(transactionManager, orderStore, inventoryLedger, cacheService, eventPublisher);
        verify(metricsService).recordOrderRejected("VALIDATION");
    }

    @Test
    @DisplayName("submit - Stock shortage on a later item rolls the whole order back")
    void submit_InsufficientStock_RollsBack() {
        // Given
        OrderSubmission submission = order().item(1L, 1, "10.00").item(2L, 9, "10.00").build();
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(orderStore.insertOrder(any(), any(), anyString(), anyString())).thenReturn(10L);
        doNothing().when(inventoryLedger).decrementStock(1L, 1);
        doThrow(new InsufficientStockException(2L, 9, 4)).when(inventoryLedger).decrementStock(2L, 9);

        // When / Then
        assertThatThrownBy(() -> engine.submit(submission))
                .isInstanceOf(InsufficientStockException.class);

        verify(transactionManager).rollback(transactionStatus);
        verify(transactionManager, never()).commit(any());
        verifyNoInteractions(cacheService, eventPublisher);
        verify(metricsService).recordOrderRejected("INSUFFICIENT_STOCK");
        verify(metricsService, never()).recordOrderSubmitted(anyInt());
    }

    @Test
    @DisplayName("submit - Pool exhaustion surfaces as PoolExhaustedException with nothing written")
    void submit_PoolExhausted_NothingWritten() {
        // Given
        OrderSubmission submission = order().item(1L, 1, "10.00").build();
        when(transactionManager.getTransaction(any())).thenThrow(new CannotCreateTransactionException(
                "Could not open JPA EntityManager for transaction",
                new SQLTransientConnectionException("Connection is not available, request timed out after 5000ms")));

        // When / Then
        assertThatThrownBy(() -> engine.submit(submission))
                .isInstanceOf(PoolExhaustedException.class);

        verifyNoInteractions(orderStore, inventoryLedger, cacheService, eventPublisher);
        verify(metricsService).recordError("POOL_EXHAUSTED", "submitOrder");
        verify(metricsService).recordOrderRejected("POOL_EXHAUSTED");
    }

    @Test
    @DisplayName("resolveStatus - Null and blank become pending")
    void resolveStatus_DefaultsToPending() {
        assertThat(OrderSubmissionEngine.resolveStatus(null)).isEqualTo("pending");
        assertThat(OrderSubmissionEngine.resolveStatus("  ")).isEqualTo("pending");
        assertThat(OrderSubmissionEngine.resolveStatus("shipped")).isEqualTo("shipped");
    }
}
