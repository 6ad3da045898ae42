package com.sensor.alerts.repository;

import com.sensor.alerts.config.BlockRegistryConfig;
import com.sensor.alerts.model.BlockStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Point lookups against the relational {@code user_blocks} table. The table
 * itself is administered elsewhere.
 */
@Repository
public class BlockRecordRepository {

    private static final String ACTIVE_BLOCK_SQL =
            "SELECT reason, blocked_by, blocked_at FROM user_blocks "
                    + "WHERE user_id = ? AND is_active = true";

    private final JdbcTemplate jdbcTemplate;

    public BlockRecordRepository(DataSource dataSource, BlockRegistryConfig config) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(config.getQueryTimeoutSeconds());
        this.jdbcTemplate.setMaxRows(1);
    }

    public Optional<BlockStatus> findActiveBlock(String userId) {
        List<BlockStatus> rows = jdbcTemplate.query(ACTIVE_BLOCK_SQL,
                (rs, rowNum) -> {
                    Timestamp blockedAt = rs.getTimestamp("blocked_at");
                    return BlockStatus.builder()
                            .blocked(true)
                            .reason(rs.getString("reason"))
                            .blockedBy(rs.getString("blocked_by"))
                            .blockedAt(blockedAt != null ? blockedAt.toInstant() : null)
                            .build();
                },
                userId);
        return rows.stream().findFirst();
    }
}
