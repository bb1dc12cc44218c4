package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
public class FinalizeResponse {
    private String responseCode;
    private String extendedTransactionResponseCode;
    private String clientTransactionResult;
    private String intendedWkstState;
    private List<String> enabledTransactions;
}
