package com.kyper.storefront.service.order;

import com.kyper.storefront.exception.OrderConstraintViolationException;
import com.kyper.storefront.exception.OrderInfrastructureException;
import com.kyper.storefront.exception.OrderSubmissionException;
import com.kyper.storefront.exception.PoolExhaustedException;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Runs one unit of order work inside its own database transaction.
 *
 * Lifecycle per call:
 * 1. Acquire a connection from the pool and begin (blocks up to the pool's
 *    connection timeout when the pool is saturated)
 * 2. Run the work on that connection
 * 3. Commit, or roll back on any exception
 * 4. Return the connection to the pool, on every path
 *
 * Failures leave this class only as {@link OrderSubmissionException} subtypes.
 * The transaction manager has already rolled back and released the connection
 * by the time they are thrown.
 *
 * @author Storefront Team
 */
@Component
public class OrderTransactionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(OrderTransactionExecutor.class);

    private final TransactionTemplate transactionTemplate;

    public OrderTransactionExecutor(
            PlatformTransactionManager transactionManager,
            @Value("${storefront.orders.transaction-timeout-seconds:10}") int timeoutSeconds
    ) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        // Always a fresh transaction: never joins one the caller may have open
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_DEFAULT);
        template.setTimeout(timeoutSeconds);
        template.setName("order-submission");
        this.transactionTemplate = template;
    }

    /**
     * Execute work atomically.
     *
     * @param work Work to run on the transactional connection
     * @return Value produced by the work, visible to others only once committed
     * @throws PoolExhaustedException if no connection became available in time
     * @throws OrderConstraintViolationException if the database rejected a write
     * @throws OrderInfrastructureException on connection loss, timeout or commit failure
     */
    public <T> T execute(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());

        } catch (OrderSubmissionException e) {
            // Raised by the work itself (e.g. insufficient stock); already rolled back
            throw e;

        } catch (DataIntegrityViolationException e) {
            throw new OrderConstraintViolationException(describeConstraint(e), e);

        } catch (CannotCreateTransactionException e) {
            if (isPoolTimeout(e)) {
                throw new PoolExhaustedException(e);
            }
            throw new OrderInfrastructureException("Could not open order transaction", e);

        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            throw new OrderInfrastructureException("Order transaction timed out", e);

        } catch (DataAccessException | TransactionException | PersistenceException e) {
            if (isTransactionTimeout(e)) {
                throw new OrderInfrastructureException("Order transaction timed out", e);
            }
            logger.debug("Order transaction failed with {}", e.getClass().getSimpleName());
            throw new OrderInfrastructureException("Order transaction failed", e);
        }
    }

    /**
     * Hikari reports an acquisition timeout as SQLTransientConnectionException,
     * wrapped by the JDBC/JPA layers.
     */
    static boolean isPoolTimeout(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SQLTransientConnectionException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Hibernate enforces the transaction deadline itself and reports expiry as
     * its own TransactionException ("transaction timeout expired"), which
     * Spring wraps in a JpaSystemException.
     */
    static boolean isTransactionTimeout(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof TransactionTimedOutException
                    || current instanceof QueryTimeoutException
                    || current instanceof jakarta.persistence.QueryTimeoutException
                    || current instanceof SQLTimeoutException) {
                return true;
            }
            if (current instanceof org.hibernate.TransactionException
                    && String.valueOf(current.getMessage()).toLowerCase(Locale.ROOT).contains("timeout")) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describeConstraint(DataIntegrityViolationException e) {
        String detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
        if (detail.contains("fk_orders_user")) {
            return "User not found";
        }
        if (detail.contains("fk_order_items_product")) {
            return "Product not found";
        }
        return "Order violates a data constraint";
    }
}
