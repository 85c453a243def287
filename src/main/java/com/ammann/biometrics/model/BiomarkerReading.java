/* (C)2026 */
package com.ammann.biometrics.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * One stored biomarker sample, as written by the ingestion side of the platform.
 *
 * <p>Read by {@link com.ammann.biometrics.source.PanacheTimeSeriesSource}; the analytics
 * engine never writes this table.
 */
@Entity
@Table(
        name = BiomarkerReading.TABLE_NAME,
        indexes = {
            @Index(name = "idx_reading_user_biomarker_ts", columnList = "user_id, biomarker, ts"),
            @Index(name = "idx_reading_ts", columnList = "ts")
        })
public class BiomarkerReading extends PanacheEntity {

    public static final String TABLE_NAME = "biomarker_readings";

    @Column(name = "user_id", nullable = false, length = 64)
    @NotNull
    public String userId;

    /** Canonical biomarker name, see {@link Biomarkers}. */
    @Column(name = "biomarker", nullable = false, length = 64)
    @NotNull
    public String biomarker;

    @Column(name = "ts", nullable = false)
    @NotNull
    public Instant timestamp;

    /**
     * Sample value. Nullable: devices report explicit gaps (e.g. signal loss) as rows
     * without a value.
     */
    @Column(name = "reading_value")
    public Double value;

    /** Originating device or vendor, informational only. */
    @Column(name = "source_device", length = 64)
    public String sourceDevice;

    @Column(name = "created_at", nullable = false)
    @NotNull
    public Instant createdAt;

    public BiomarkerReading() {}

    public BiomarkerReading(String userId, String biomarker, Instant timestamp, Double value) {
        this.userId = userId;
        this.biomarker = biomarker;
        this.timestamp = timestamp;
        this.value = value;
        this.createdAt = Instant.now();
    }

    /**
     * Readings of one biomarker for one user in {@code [start, end]}, oldest first.
     */
    public static List<BiomarkerReading> findSeries(
            String userId, String biomarker, Instant start, Instant end) {
        return find(
                        "userId = ?1 AND biomarker = ?2 AND timestamp >= ?3 AND timestamp <= ?4 ORDER BY timestamp",
                        userId,
                        biomarker,
                        start,
                        end)
                .list();
    }

    /**
     * Distinct users with at least one reading at or after {@code since}.
     */
    public static List<String> findActiveUserIds(Instant since) {
        return getEntityManager()
                .createQuery(
                        "SELECT DISTINCT r.userId FROM BiomarkerReading r WHERE r.timestamp >= :since ORDER BY r.userId",
                        String.class)
                .setParameter("since", since)
                .getResultList();
    }
}
