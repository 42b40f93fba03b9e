package com.kyper.storefront.api.controller;

import com.kyper.storefront.api.dto.HealthResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness banner and database health check.
 *
 * @author Storefront Team
 */
@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    static final String BANNER = "Kyper3D API is running correctly.";

    private final JdbcTemplate jdbcTemplate;

    public HealthController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String root() {
        return BANNER;
    }

    /**
     * Run a trivial query against the database.
     *
     * @return 200 with db_check=true, or 500 with the failure message
     */
    @GetMapping("/api/health")
    public ResponseEntity<HealthResponse> health() {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1 + 1", Integer.class);
            return ResponseEntity.ok(HealthResponse.ok(result != null && result == 2));
        } catch (DataAccessException e) {
            logger.error("Database health check failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(HealthResponse.error(e.getMostSpecificCause().getMessage()));
        }
    }
}
