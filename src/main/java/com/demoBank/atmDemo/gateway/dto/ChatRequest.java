package com.demoBank.atmDemo.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for chat messages.
 * The session comes from the X-Session-Token header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRequest {

    @NotBlank(message = "messageText cannot be blank")
    @Size(max = 1000)
    private String messageText;

    /**
     * PIN block captured by the keypad during this turn, if any.
     */
    @ToString.Exclude
    private String encryptedPinData;
}
