package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class PinValidationRequest {

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientRequestNumber;

    @NotBlank
    @ToString.Exclude
    private String encryptedPinData;

    private EmvAuthorizeData emvAuthorizeRequestData;

    /**
     * Client correlation token, echoed unchanged.
     */
    private String breadcrumb;
}
