package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Phase 1 request: card read at the terminal.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class LoginRequest {

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientRequestNumber;

    private String clientRequestTime;
    private String clientUniqueHardwareId;

    @Valid
    @NotNull
    private ConsumerIdentificationData consumerIdentificationData;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class ConsumerIdentificationData {

        @NotBlank
        private String track2;

        /**
         * Chip data, passed through untouched.
         */
        @JsonProperty("EMVTags")
        private List<String> emvTags;

        private String manualDataType;
    }
}
