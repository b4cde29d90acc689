package com.climbwatch.occupancy.store;

import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.Branch;
import com.climbwatch.occupancy.model.OccupancyReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Types;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational store (MySQL on Cloud SQL in production).
 *
 * branch_id holds {@link Branch#storageId()}; there is no foreign key, the mapping
 * lives in the Branch enum. Every statement is parameterised.
 */
@Slf4j
public class JdbcBranchStore implements BranchStore {

    private static final String INSERT_OCCUPANCY = """
            INSERT INTO branch_data (branch_id, last_updated, name, status, current_percentage)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String DELETE_ATTENDANCE = "DELETE FROM expected_attendance WHERE branch_id = ?";

    private static final String INSERT_ATTENDANCE = """
            INSERT INTO expected_attendance (branch_id, slot_hour, percentage, remaining)
            VALUES (?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Duration timestampOffset;

    public JdbcBranchStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                           Duration timestampOffset) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.timestampOffset = timestampOffset;
    }

    @Override
    public void ensureSchema() {
        log.info("Ensuring branch tables exist...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS branch_data
            (
                id                  BIGINT AUTO_INCREMENT PRIMARY KEY,
                branch_id           INT NOT NULL,
                last_updated        DATETIME NULL,
                name                VARCHAR(128),
                status              VARCHAR(128),
                current_percentage  DOUBLE NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS expected_attendance
            (
                id                  BIGINT AUTO_INCREMENT PRIMARY KEY,
                branch_id           INT NOT NULL,
                slot_hour           INT NOT NULL,
                percentage          DOUBLE NOT NULL,
                remaining           DOUBLE NULL
            )
        """);

        log.info("Branch tables ready.");
    }

    @Override
    public void recordOccupancy(Branch branch, OccupancyReading reading) {
        jdbcTemplate.update(INSERT_OCCUPANCY, ps -> {
            ps.setInt(1, branch.storageId());
            LocalDateTime lastUpdated = toStoredDateTime(reading.getLastUpdated());
            if (lastUpdated != null) {
                ps.setObject(2, lastUpdated);
            } else {
                ps.setNull(2, Types.TIMESTAMP);
            }
            ps.setString(3, reading.getName());
            ps.setString(4, reading.getStatus());
            ps.setDouble(5, reading.getCurrentPercentage());
        });
        log.debug("Inserted occupancy row for {}", branch.branchName());
    }

    /**
     * Delete and re-insert the branch's forecast in one transaction, so concurrent
     * refreshes cannot interleave and a failed insert keeps the old rows.
     */
    @Override
    public void replaceAttendance(Branch branch, List<AttendanceSlot> slots) {
        List<Object[]> rows = slots.stream()
                .map(s -> new Object[]{branch.storageId(), s.getHour(), s.getPercentage(), s.getRemaining()})
                .toList();

        transactionTemplate.executeWithoutResult(status -> {
            int deleted = jdbcTemplate.update(DELETE_ATTENDANCE, branch.storageId());
            jdbcTemplate.batchUpdate(INSERT_ATTENDANCE, rows,
                    new int[]{Types.INTEGER, Types.INTEGER, Types.DOUBLE, Types.DOUBLE});
            log.debug("Replaced {} attendance rows with {} for {}", deleted, rows.size(), branch.branchName());
        });
    }

    @Override
    public Map<String, List<OccupancyReading>> readOccupancy() {
        List<StoredRow<OccupancyReading>> rows = jdbcTemplate.query("""
                SELECT branch_id, last_updated, name, status, current_percentage
                FROM branch_data
                ORDER BY id
                """, (rs, rowNum) -> new StoredRow<>(rs.getInt("branch_id"), OccupancyReading.builder()
                .lastUpdated(fromStoredDateTime(rs.getObject("last_updated", LocalDateTime.class)))
                .name(rs.getString("name"))
                .status(rs.getString("status"))
                .currentPercentage(rs.getDouble("current_percentage"))
                .build()));
        return groupByBranch(rows);
    }

    @Override
    public Map<String, List<AttendanceSlot>> readAttendance() {
        List<StoredRow<AttendanceSlot>> rows = jdbcTemplate.query("""
                SELECT branch_id, slot_hour, percentage, remaining
                FROM expected_attendance
                ORDER BY id
                """, (rs, rowNum) -> new StoredRow<>(rs.getInt("branch_id"), AttendanceSlot.builder()
                .hour(rs.getInt("slot_hour"))
                .percentage(rs.getDouble("percentage"))
                .remaining(rs.getObject("remaining", Double.class))
                .build()));
        return groupByBranch(rows);
    }

    @Override
    public String describe() {
        return "jdbc";
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Wall-clock value written to last_updated: UTC plus the configured offset. Bound as
     * a LocalDateTime so the JVM's default zone plays no part.
     */
    LocalDateTime toStoredDateTime(OffsetDateTime value) {
        if (value == null) return null;
        return value.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime().plus(timestampOffset);
    }

    OffsetDateTime fromStoredDateTime(LocalDateTime value) {
        if (value == null) return null;
        return value.minus(timestampOffset).atOffset(ZoneOffset.UTC);
    }

    /**
     * Group rows under their branch name, keeping table order. Rows whose branch_id
     * maps to no branch are dropped.
     */
    private static <T> Map<String, List<T>> groupByBranch(List<StoredRow<T>> rows) {
        Map<String, List<T>> result = new LinkedHashMap<>();
        for (Branch branch : Branch.values()) {
            result.put(branch.branchName(), new ArrayList<>());
        }
        for (StoredRow<T> row : rows) {
            Optional<Branch> branch = Branch.fromStorageId(row.branchId());
            if (branch.isPresent()) {
                result.get(branch.get().branchName()).add(row.item());
            } else {
                log.warn("Skipping row with unknown branch_id {}", row.branchId());
            }
        }
        return result;
    }

    private record StoredRow<T>(int branchId, T item) {}
}
