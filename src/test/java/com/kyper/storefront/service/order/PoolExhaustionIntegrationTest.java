package com.kyper.storefront.service.order;

import com.kyper.storefront.domain.model.Product;
import com.kyper.storefront.exception.PoolExhaustedException;
import com.kyper.storefront.repository.OrderItemRepository;
import com.kyper.storefront.repository.OrderRepository;
import com.kyper.storefront.repository.ProductRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import javax.sql.DataSource;
import java.sql.Connection;

import static com.kyper.storefront.testutil.TestDataBuilder.order;
import static com.kyper.storefront.testutil.TestDataBuilder.product;
import static org.assertj.core.api.Assertions.*;

/**
 * Order submission against a deliberately tiny connection pool.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:storefront_pool;MODE=MySQL;DB_CLOSE_DELAY=-1",
    "spring.datasource.hikari.maximum-pool-size=2",
    "spring.datasource.hikari.minimum-idle=0",
    "spring.datasource.hikari.connection-timeout=250"
})
@DisplayName("Pool Exhaustion Integration Tests")
class PoolExhaustionIntegrationTest {

    @Autowired
    private OrderSubmissionEngine engine;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private DataSource dataSource;

    @Test
    @DisplayName("Saturated pool fails fast with PoolExhaustedException; orders succeed once connections return")
    void submit_PoolSaturated_FailsThenRecovers() throws Exception {
        // Given
        orderItemRepository.deleteAllInBatch();
        orderRepository.deleteAllInBatch();
        Product figure = productRepository.save(product().stock(5).build());
        long ordersBefore = orderRepository.count();

        // When: every pooled connection is held elsewhere
        try (Connection first = dataSource.getConnection();
             Connection second = dataSource.getConnection()) {

            // Then
            assertThatThrownBy(() -> engine.submit(order().item(figure.getId(), 1, "25.00").build()))
                    .isInstanceOf(PoolExhaustedException.class)
                    .satisfies(e -> assertThat(((PoolExhaustedException) e).getReason()).isEqualTo("POOL_EXHAUSTED"));
        }

        assertThat(orderRepository.count()).isEqualTo(ordersBefore);
        assertThat(productRepository.findStockById(figure.getId())).isEqualTo(5);

        // And the same submission succeeds once the pool has capacity again
        SubmittedOrder result = engine.submit(order().item(figure.getId(), 1, "25.00").build());
        assertThat(result.getOrderId()).isNotNull();
        assertThat(productRepository.findStockById(figure.getId())).isEqualTo(4);
    }
}
