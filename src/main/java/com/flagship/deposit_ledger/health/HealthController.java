package com.flagship.deposit_ledger.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unauthenticated readiness probe.
 *
 * Reports UP only when both ledger tables answer a trivial query, which also
 * catches a database that is reachable but not yet migrated.
 */
@RestController
@Slf4j
public class HealthController {

    static final List<String> LEDGER_TABLES = List.of("accounts", "transactions");

    private final JdbcTemplate jdbcTemplate;

    public HealthController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> tables = new LinkedHashMap<>();
        boolean healthy = true;
        for (String table : LEDGER_TABLES) {
            boolean tableUp = probe(table);
            tables.put(table, tableUp ? "UP" : "DOWN");
            healthy &= tableUp;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", healthy ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());
        response.put("tables", tables);

        return healthy ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
    }

    private boolean probe(String table) {
        try {
            jdbcTemplate.queryForList("SELECT 1 FROM " + table + " LIMIT 1");
            return true;
        } catch (DataAccessException e) {
            log.warn("Health probe failed for table {}: {}", table, e.getMessage());
            return false;
        }
    }
}
