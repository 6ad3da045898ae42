package com.sensor.alerts.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;

/**
 * Result of one push attempt. Exactly one of {@code blocked}, {@code skipped},
 * {@code result} or {@code error} is set; absent fields are omitted from JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Per-recipient push notification outcome")
public class PushOutcome {

    public enum Kind { BLOCKED, SKIPPED, DELIVERED, ERROR }

    @Schema(description = "Recipient account", example = "user-456")
    private String userId;

    private boolean success;

    @Schema(description = "Set when the recipient is blocked")
    private Boolean blocked;

    @Schema(description = "Block reason, present with blocked")
    private String reason;

    @Schema(description = "Set when the recipient has no registered push token")
    private Boolean skipped;

    @Schema(description = "Push gateway response, present on delivery")
    private Object result;

    @Schema(description = "Failure message, present when the send failed")
    private String error;

    public static PushOutcome blocked(String userId, String reason) {
        return PushOutcome.builder().userId(userId).success(false).blocked(true).reason(reason).build();
    }

    public static PushOutcome skipped(String userId) {
        return PushOutcome.builder().userId(userId).success(false).skipped(true).build();
    }

    /**
     * A gateway reply with an empty body is recorded as an empty result so
     * that a delivered outcome always carries {@code result}.
     */
    public static PushOutcome delivered(String userId, Object result) {
        return PushOutcome.builder()
                .userId(userId)
                .success(true)
                .result(result != null ? result : Collections.emptyMap())
                .build();
    }

    public static PushOutcome failed(String userId, String error) {
        return PushOutcome.builder().userId(userId).success(false).error(error).build();
    }

    @JsonIgnore
    public Kind getKind() {
        if (Boolean.TRUE.equals(blocked)) return Kind.BLOCKED;
        if (Boolean.TRUE.equals(skipped)) return Kind.SKIPPED;
        if (error != null) return Kind.ERROR;
        return Kind.DELIVERED;
    }
}
