/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.adapter.outbound.audit;

import me.golemcore.agent.domain.exception.AuditStoreException;
import me.golemcore.agent.domain.model.AuditEntry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.AuditStorePort;
import me.golemcore.agent.security.Sandbox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed audit store.
 *
 * <p>
 * One append-only table {@code audit_log}, created on first use. There is no
 * update or delete path. A relative {@code agent.audit.database-path} is
 * resolved under {@code <storage base>/audit}.
 */
@Component
@Slf4j
public class JdbcAuditStoreAdapter implements AuditStorePort {

    private static final String AUDIT_DIR = "audit";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS audit_log (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                timestamp TEXT NOT NULL,
                event_type TEXT NOT NULL,
                session_id TEXT,
                source TEXT,
                tool_name TEXT,
                parameters TEXT,
                result_summary TEXT,
                approval_status TEXT,
                risk_level TEXT,
                hmac TEXT NOT NULL
            )
            """;

    private static final List<String> CREATE_INDEX_SQL = List.of(
            "CREATE INDEX IF NOT EXISTS idx_audit_timestamp ON audit_log(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_audit_session ON audit_log(session_id)",
            "CREATE INDEX IF NOT EXISTS idx_audit_tool ON audit_log(tool_name)");

    private static final String INSERT_SQL = """
            INSERT INTO audit_log
                (timestamp, event_type, session_id, source, tool_name,
                 parameters, result_summary, approval_status, risk_level, hmac)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final RowMapper<AuditEntry> ROW_MAPPER = (rs, rowNum) -> AuditEntry.builder()
            .id(rs.getLong("id"))
            .timestamp(nz(rs.getString("timestamp")))
            .eventType(nz(rs.getString("event_type")))
            .sessionId(nz(rs.getString("session_id")))
            .source(nz(rs.getString("source")))
            .toolName(nz(rs.getString("tool_name")))
            .parameters(nz(rs.getString("parameters")))
            .resultSummary(nz(rs.getString("result_summary")))
            .approvalStatus(nz(rs.getString("approval_status")))
            .riskLevel(nz(rs.getString("risk_level")))
            .hmac(nz(rs.getString("hmac")))
            .build();

    private final Path databasePath;
    private final JdbcTemplate jdbcTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile boolean initialized;

    public JdbcAuditStoreAdapter(AgentProperties properties) {
        this.databasePath = resolveDatabasePath(properties);
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + databasePath);
        dataSource.setDriverClassName("org.sqlite.JDBC");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        log.info("[Audit] Audit database: {}", databasePath);
    }

    static Path resolveDatabasePath(AgentProperties properties) {
        Path configured = Paths.get(Sandbox.expandPath(
                AgentProperties.expandUserHome(properties.getAudit().getDatabasePath())));
        if (configured.isAbsolute()) {
            return configured.normalize();
        }
        return properties.resolveStorageBasePath().resolve(AUDIT_DIR).resolve(configured).normalize();
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    @Override
    public void append(AuditEntry entry) {
        ensureSchema();
        writeLock.lock();
        try {
            jdbcTemplate.update(INSERT_SQL,
                    entry.getTimestamp(), entry.getEventType(), entry.getSessionId(), entry.getSource(),
                    entry.getToolName(), entry.getParameters(), entry.getResultSummary(),
                    entry.getApprovalStatus(), entry.getRiskLevel(), entry.getHmac());
        } catch (DataAccessException e) {
            throw new AuditStoreException("Failed to append audit entry", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<AuditEntry> findRecent(int limit, String sessionId, String eventType) {
        ensureSchema();
        StringBuilder sql = new StringBuilder("SELECT * FROM audit_log");
        List<Object> args = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        if (sessionId != null) {
            conditions.add("session_id = ?");
            args.add(sessionId);
        }
        if (eventType != null) {
            conditions.add("event_type = ?");
            args.add(eventType);
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY id DESC LIMIT ?");
        args.add(Math.max(limit, 0));

        try {
            return jdbcTemplate.query(sql.toString(), ROW_MAPPER, args.toArray());
        } catch (DataAccessException e) {
            throw new AuditStoreException("Failed to query audit log", e);
        }
    }

    @Override
    public List<AuditEntry> findBetween(String fromInclusive, String toExclusive) {
        ensureSchema();
        try {
            return jdbcTemplate.query(
                    "SELECT * FROM audit_log WHERE timestamp >= ? AND timestamp < ? ORDER BY id ASC",
                    ROW_MAPPER, fromInclusive, toExclusive);
        } catch (DataAccessException e) {
            throw new AuditStoreException("Failed to query audit log", e);
        }
    }

    private void ensureSchema() {
        if (initialized) {
            return;
        }
        synchronized (this) {
            if (initialized) {
                return;
            }
            try {
                Path parent = databasePath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                jdbcTemplate.execute(CREATE_TABLE_SQL);
                CREATE_INDEX_SQL.forEach(jdbcTemplate::execute);
            } catch (IOException e) {
                throw new AuditStoreException("Failed to create audit directory: " + databasePath.getParent(), e);
            } catch (DataAccessException e) {
                throw new AuditStoreException("Failed to initialize audit schema", e);
            }
            initialized = true;
            log.debug("[Audit] Schema ready at {}", databasePath);
        }
    }

    private static String nz(String value) {
        return value != null ? value : "";
    }
}
