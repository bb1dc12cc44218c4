package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Opaque chip tags. Echoed back, never interpreted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmvAuthorizeData {

    @JsonProperty("Tag57")
    private String tag57;

    @JsonProperty("Tag5FA")
    private String tag5FA;
}
