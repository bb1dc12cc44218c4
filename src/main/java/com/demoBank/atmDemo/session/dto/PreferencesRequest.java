package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class PreferencesRequest {

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientRequestNumber;

    private String clientRequestTime;
    private String clientUniqueHardwareId;
    private String cardPosition;

    @Valid
    @NotNull
    private Preferences preferences;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class Preferences {

        @NotBlank
        private String language;

        @Email
        @JsonProperty("EmailID")
        private String emailId;

        /**
         * PRINT, EMAIL or NONE, any case.
         */
        @NotBlank
        private String receiptPreference;

        private boolean fastCashPreference;
    }
}
