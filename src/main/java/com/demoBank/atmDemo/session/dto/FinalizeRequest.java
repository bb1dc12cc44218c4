package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class FinalizeRequest {

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientRequestNumber;

    private String clientRequestTime;
    private String clientUniqueHardwareId;
    private String cardPosition;

    /**
     * Completed or Cancelled.
     */
    @NotBlank
    private String clientTransactionResult;

    private String accountingState;
    private String cardUpdateState;
    private EmvFinalizeData emvFinalizeRequestData;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class EmvFinalizeData {
        private List<String> tags;
    }
}
