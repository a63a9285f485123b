package com.coffee.diagnosis.service.store;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates the request log and prediction tables when they are missing.
 */
public final class SqliteSchema {

    private SqliteSchema() {
    }

    public static void create(JdbcTemplate jdbc) {
        jdbc.execute("CREATE TABLE IF NOT EXISTS processing_request ("
                + "request_id TEXT PRIMARY KEY, "
                + "image_ref TEXT NOT NULL, "
                + "symptom_ids TEXT, "
                + "status TEXT NOT NULL, "
                + "mode TEXT NOT NULL, "
                + "error TEXT, "
                + "prediction_id INTEGER, "
                + "requested_ts INTEGER NOT NULL, "
                + "updated_ts INTEGER NOT NULL"
                + ")");
        jdbc.execute("CREATE TABLE IF NOT EXISTS prediction ("
                + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                + "request_id TEXT NOT NULL UNIQUE, "
                + "image_ref TEXT NOT NULL, "
                + "image_hash TEXT, "
                + "disease_name TEXT NOT NULL, "
                + "confidence REAL NOT NULL, "
                + "final_confidence REAL, "
                + "severity TEXT NOT NULL, "
                + "model_version TEXT NOT NULL, "
                + "processing_time_ms INTEGER NOT NULL, "
                + "description TEXT, "
                + "treatment TEXT, "
                + "created_ts INTEGER NOT NULL"
                + ")");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_request_image ON processing_request (image_ref, updated_ts)");
    }
}
