package com.sensor.alerts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String error;
    private String reason;
    private String message;
    private String path;

    public static ErrorResponse of(String error) {
        return ErrorResponse.builder().error(error).build();
    }
}
