package com.checkmate.pos_sync.line;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Daily ledger header of one (meal type, line number, date).
 *
 * Rows are created by {@link LineLogRepository#insertIfAbsent}; this entity only
 * ever moves a log forward (open, then close). Till snapshots are opaque JSON.
 */
@Entity
@Table(
    name = "line_logs",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_line_logs_line_day",
        columnNames = {"meal_type", "line_num", "line_date"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LineLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "meal_type", nullable = false, updatable = false, length = 1)
    private String mealType;

    @Column(name = "line_num", nullable = false, updatable = false)
    private int lineNum;

    @Column(name = "line_date", nullable = false, updatable = false)
    private LocalDate lineDate;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "opened_by")
    private Long openedBy;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "closed_by")
    private Long closedBy;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "start_till", columnDefinition = "jsonb")
    private String startTill;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "end_till", columnDefinition = "jsonb")
    private String endTill;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LineLogStatus getStatus() {
        if (closedAt != null) {
            return LineLogStatus.CLOSED;
        }
        if (openedAt != null) {
            return LineLogStatus.OPEN;
        }
        return LineLogStatus.NOT_OPENED;
    }

    /**
     * @return false if the log is already closed; true if it is (now) open
     */
    boolean open(long userId, String startTill) {
        LineLogStatus status = getStatus();
        if (status == LineLogStatus.CLOSED) {
            return false;
        }
        if (status == LineLogStatus.OPEN) {
            return true;
        }
        this.openedAt = Instant.now();
        this.openedBy = userId;
        this.startTill = startTill;
        return true;
    }

    void close(long userId, String endTill) {
        if (getStatus() != LineLogStatus.OPEN) {
            throw new IllegalStateException(String.format(
                "Line log %d is %s and cannot be closed", id, getStatus()));
        }
        this.closedAt = Instant.now();
        this.closedBy = userId;
        this.endTill = endTill;
    }
}
