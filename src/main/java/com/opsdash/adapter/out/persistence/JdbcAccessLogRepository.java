package com.opsdash.adapter.out.persistence;

import com.opsdash.application.port.out.AccessLogRepository;
import com.opsdash.domain.model.AccessLog;
import com.opsdash.domain.model.AccessResult;
import com.opsdash.domain.model.AccessType;
import com.opsdash.domain.model.PersonType;
import com.opsdash.pagination.exec.QuerySource;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public class JdbcAccessLogRepository implements AccessLogRepository {

    static final String TABLE = "access_logs";

    static final Set<String> COLUMNS = Set.of(
        "id", "access_time", "building_id", "person_name", "person_document", "person_type",
        "access_type", "access_result", "access_method", "device_id", "processing_time");

    private static final RowMapper<AccessLog> ROW_MAPPER = (rs, rowNum) -> new AccessLog(
        UUID.fromString(rs.getString("id")),
        rs.getTimestamp("access_time").toInstant(),
        rs.getString("building_id"),
        rs.getString("person_name"),
        rs.getString("person_document"),
        PersonType.fromDb(rs.getString("person_type")),
        AccessType.fromDb(rs.getString("access_type")),
        AccessResult.fromDb(rs.getString("access_result")),
        rs.getString("access_method"),
        rs.getString("device_id"),
        rs.getObject("processing_time", Integer.class)
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final JdbcQuerySource<AccessLog> querySource;

    public JdbcAccessLogRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.querySource = new JdbcQuerySource<>(jdbc, TABLE, COLUMNS, ROW_MAPPER, JdbcAccessLogRepository::readField);
    }

    @Override
    public void save(AccessLog accessLog) {
        jdbc.update("""
            INSERT INTO access_logs (id, access_time, building_id, person_name, person_document, person_type,
                                     access_type, access_result, access_method, device_id, processing_time)
            VALUES (:id, :accessTime, :buildingId, :personName, :personDocument, :personType,
                    :accessType, :accessResult, :accessMethod, :deviceId, :processingTime)
            """,
            new MapSqlParameterSource()
                .addValue("id", accessLog.id())
                .addValue("accessTime", Timestamp.from(accessLog.accessTime()))
                .addValue("buildingId", accessLog.buildingId())
                .addValue("personName", accessLog.personName())
                .addValue("personDocument", accessLog.personDocument())
                .addValue("personType", accessLog.personType().dbValue())
                .addValue("accessType", accessLog.accessType().dbValue())
                .addValue("accessResult", accessLog.accessResult().dbValue())
                .addValue("accessMethod", accessLog.accessMethod())
                .addValue("deviceId", accessLog.deviceId())
                .addValue("processingTime", accessLog.processingTimeMs(), Types.INTEGER)
        );
    }

    @Override
    public Optional<AccessLog> findById(UUID id) {
        return jdbc.query("SELECT * FROM access_logs WHERE id = :id", Map.of("id", id), ROW_MAPPER)
            .stream().findFirst();
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM access_logs", Map.of(), Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM access_logs", Map.of());
    }

    @Override
    public QuerySource<AccessLog> asQuerySource() {
        return querySource;
    }

    static Object readField(AccessLog row, String field) {
        return switch (field) {
            case "id" -> row.id();
            case "access_time" -> row.accessTime();
            case "building_id" -> row.buildingId();
            case "person_name" -> row.personName();
            case "person_document" -> row.personDocument();
            case "person_type" -> row.personType().dbValue();
            case "access_type" -> row.accessType().dbValue();
            case "access_result" -> row.accessResult().dbValue();
            case "access_method" -> row.accessMethod();
            case "device_id" -> row.deviceId();
            case "processing_time" -> row.processingTimeMs();
            default -> throw new IllegalArgumentException("Unknown access log column: " + field);
        };
    }
}
