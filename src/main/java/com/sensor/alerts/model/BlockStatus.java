package com.sensor.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockStatus {

    private boolean blocked;
    private String reason;
    private String blockedBy;
    private Instant blockedAt;

    public static BlockStatus notBlocked() {
        return BlockStatus.builder().blocked(false).build();
    }
}
