package com.sensor.alerts.service;

import com.sensor.alerts.config.MetricsConfig;
import com.sensor.alerts.model.BlockStatus;
import com.sensor.alerts.repository.BlockRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Answers whether an account is currently blocked.
 *
 * Lookups fail open: if the block list cannot be queried the account is
 * reported as not blocked, so a database outage never stops alert delivery.
 */
@Service
public class BlockRegistry {

    private static final Logger log = LoggerFactory.getLogger(BlockRegistry.class);

    private final BlockRecordRepository blockRecordRepository;
    private final MetricsConfig metricsConfig;

    public BlockRegistry(BlockRecordRepository blockRecordRepository, MetricsConfig metricsConfig) {
        this.blockRecordRepository = blockRecordRepository;
        this.metricsConfig = metricsConfig;
    }

    public BlockStatus checkBlocked(String userId) {
        try {
            Optional<BlockStatus> block = blockRecordRepository.findActiveBlock(userId);
            if (block.isPresent()) {
                log.info("User {} is BLOCKED: {}", userId, block.get().getReason());
                return block.get();
            }
            return BlockStatus.notBlocked();
        } catch (RuntimeException e) {
            metricsConfig.recordBlockCheckFailure();
            log.error("Error checking block status for user={}, allowing: {}", userId, e.getMessage(), e);
            return BlockStatus.notBlocked();
        }
    }
}
