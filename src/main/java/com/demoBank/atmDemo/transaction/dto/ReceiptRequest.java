package com.demoBank.atmDemo.transaction.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReceiptRequest {

    @NotBlank
    private String transactionId;

    /**
     * PRINT, EMAIL or NONE; defaults to the session's receipt preference.
     */
    private String mode;

    @Email
    private String email;
}
