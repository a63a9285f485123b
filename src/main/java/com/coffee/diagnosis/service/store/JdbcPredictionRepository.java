package com.coffee.diagnosis.service.store;

import com.coffee.diagnosis.model.HealthStatus;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.ProcessingMode;
import com.coffee.diagnosis.model.ProcessingRequest;
import com.coffee.diagnosis.model.RequestStatus;
import com.coffee.diagnosis.model.RequestStatusRecord;
import com.coffee.diagnosis.model.SeverityLevel;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * SQLite-backed request log. Inserts use {@code ON CONFLICT(request_id)} so that a redelivered
 * request finds its earlier rows instead of writing new ones.
 */
public class JdbcPredictionRepository implements PredictionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPredictionRepository.class);

    static final int MAX_ERROR_LENGTH = 500;

    private static final String REQUEST_COLUMNS =
            "request_id, image_ref, status, mode, error, prediction_id, requested_ts, updated_ts";

    private final JdbcTemplate jdbc;

    public JdbcPredictionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        SqliteSchema.create(jdbc);
    }

    @Override
    public void recordSubmission(ProcessingRequest request, ProcessingMode mode) {
        long now = System.currentTimeMillis();
        String symptoms = request.symptomIds().stream().map(String::valueOf).collect(Collectors.joining(","));
        // a failed request may be resubmitted under the same id; anything else keeps its row
        jdbc.update("INSERT INTO processing_request "
                        + "(request_id, image_ref, symptom_ids, status, mode, error, prediction_id, requested_ts, updated_ts) "
                        + "VALUES (?, ?, ?, ?, ?, NULL, NULL, ?, ?) "
                        + "ON CONFLICT(request_id) DO UPDATE SET image_ref = excluded.image_ref, "
                        + "symptom_ids = excluded.symptom_ids, status = excluded.status, mode = excluded.mode, "
                        + "error = NULL, requested_ts = excluded.requested_ts, updated_ts = excluded.updated_ts "
                        + "WHERE processing_request.status = 'FAILED'",
                request.requestId(), request.imageRef(), symptoms, RequestStatus.PENDING.name(), mode.name(),
                request.requestedAt().toEpochMilli(), now);
    }

    @Override
    public long savePrediction(String requestId, String imageRef, PredictionResult result) {
        jdbc.update("INSERT INTO prediction (request_id, image_ref, image_hash, disease_name, confidence, "
                        + "final_confidence, severity, model_version, processing_time_ms, description, treatment, created_ts) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                        + "ON CONFLICT(request_id) DO NOTHING",
                requestId, imageRef, result.imageHash(), result.diseaseName(), result.confidence(),
                result.finalConfidence(), result.severityLevel().name(), result.modelVersion(),
                result.processingTimeMs(), result.description(), result.treatmentSuggestion(),
                result.createdAt().toEpochMilli());
        Long id = jdbc.queryForObject("SELECT id FROM prediction WHERE request_id = ?", Long.class, requestId);
        jdbc.update("UPDATE processing_request SET prediction_id = ?, updated_ts = ? WHERE request_id = ?",
                id, System.currentTimeMillis(), requestId);
        return id;
    }

    @Override
    public void updateRequestStatus(String requestId, RequestStatus status, String error) {
        int updated = jdbc.update(
                "UPDATE processing_request SET status = ?, error = ?, updated_ts = ? WHERE request_id = ?",
                status.name(), truncate(error), System.currentTimeMillis(), requestId);
        if (updated == 0) {
            log.warn("Status {} for unknown request {} was not recorded", status, requestId);
        }
    }

    @Override
    public Optional<RequestStatusRecord> getRequestStatus(String requestId) {
        List<RequestStatusRecord> rows = jdbc.query(
                "SELECT " + REQUEST_COLUMNS + " FROM processing_request WHERE request_id = ?",
                REQUEST_MAPPER, requestId);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<RequestStatusRecord> findLatestByImageRef(String imageRef) {
        List<RequestStatusRecord> rows = jdbc.query(
                "SELECT " + REQUEST_COLUMNS + " FROM processing_request WHERE image_ref = ? "
                        + "ORDER BY updated_ts DESC, requested_ts DESC LIMIT 1",
                REQUEST_MAPPER, imageRef);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<PredictionResult> findPrediction(long predictionId) {
        List<PredictionResult> rows = jdbc.query("SELECT * FROM prediction WHERE id = ?", PREDICTION_MAPPER,
                predictionId);
        return rows.stream().findFirst();
    }

    @Override
    public int countPredictions(String requestId) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM prediction WHERE request_id = ?", Integer.class,
                requestId);
        return count == null ? 0 : count;
    }

    @Override
    public HealthStatus health() {
        try {
            Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM prediction", Integer.class);
            return HealthStatus.up("persistence", count + " predictions stored");
        } catch (DataAccessException ex) {
            return HealthStatus.down("persistence", ex.getMessage());
        }
    }

    static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private static final RowMapper<RequestStatusRecord> REQUEST_MAPPER = (rs, rowNum) -> new RequestStatusRecord(
            rs.getString("request_id"),
            rs.getString("image_ref"),
            RequestStatus.valueOf(rs.getString("status")),
            ProcessingMode.valueOf(rs.getString("mode")),
            rs.getString("error"),
            nullableLong(rs, "prediction_id"),
            Instant.ofEpochMilli(rs.getLong("requested_ts")),
            Instant.ofEpochMilli(rs.getLong("updated_ts")));

    private static final RowMapper<PredictionResult> PREDICTION_MAPPER = (rs, rowNum) -> new PredictionResult(
            rs.getLong("id"),
            rs.getString("disease_name"),
            rs.getDouble("confidence"),
            nullableDouble(rs, "final_confidence"),
            SeverityLevel.valueOf(rs.getString("severity")),
            rs.getString("model_version"),
            rs.getLong("processing_time_ms"),
            Instant.ofEpochMilli(rs.getLong("created_ts")),
            rs.getString("description"),
            rs.getString("treatment"),
            List.of(),
            rs.getString("image_hash"));

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
