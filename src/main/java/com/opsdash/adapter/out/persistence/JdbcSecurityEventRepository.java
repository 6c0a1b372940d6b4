package com.opsdash.adapter.out.persistence;

import com.opsdash.application.port.out.SecurityEventRepository;
import com.opsdash.domain.model.SecurityEvent;
import com.opsdash.domain.model.Severity;
import com.opsdash.pagination.exec.QuerySource;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Repository
public class JdbcSecurityEventRepository implements SecurityEventRepository {

    static final String TABLE = "security_events";

    static final Set<String> COLUMNS = Set.of(
        "id", "event_type", "severity", "severity_rank", "description", "building_id", "resolved", "created_at");

    private static final RowMapper<SecurityEvent> ROW_MAPPER = (rs, rowNum) -> new SecurityEvent(
        UUID.fromString(rs.getString("id")),
        rs.getString("event_type"),
        Severity.fromDb(rs.getString("severity")),
        rs.getString("description"),
        rs.getString("building_id"),
        rs.getBoolean("resolved"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final JdbcQuerySource<SecurityEvent> querySource;

    public JdbcSecurityEventRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.querySource = new JdbcQuerySource<>(
            jdbc, TABLE, COLUMNS, ROW_MAPPER, JdbcSecurityEventRepository::readField);
    }

    @Override
    public void save(SecurityEvent event) {
        jdbc.update("""
            INSERT INTO security_events (id, event_type, severity, severity_rank, description,
                                         building_id, resolved, created_at)
            VALUES (:id, :eventType, :severity, :severityRank, :description, :buildingId, :resolved, :createdAt)
            """,
            new MapSqlParameterSource()
                .addValue("id", event.id())
                .addValue("eventType", event.eventType())
                .addValue("severity", event.severity().dbValue())
                .addValue("severityRank", event.severity().rank())
                .addValue("description", event.description())
                .addValue("buildingId", event.buildingId())
                .addValue("resolved", event.resolved())
                .addValue("createdAt", Timestamp.from(event.createdAt()))
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM security_events", Map.of(), Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM security_events", Map.of());
    }

    @Override
    public QuerySource<SecurityEvent> asQuerySource() {
        return querySource;
    }

    static Object readField(SecurityEvent row, String field) {
        return switch (field) {
            case "id" -> row.id();
            case "event_type" -> row.eventType();
            case "severity" -> row.severity().dbValue();
            case "severity_rank" -> row.severity().rank();
            case "description" -> row.description();
            case "building_id" -> row.buildingId();
            case "resolved" -> row.resolved();
            case "created_at" -> row.createdAt();
            default -> throw new IllegalArgumentException("Unknown security event column: " + field);
        };
    }
}
