package com.demoBank.atmDemo.flow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered UI steps for one intent's execution. At most one flow per intent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScreenFlow {

    private String id;
    private String intentId;
    private String sessionId;

    @Builder.Default
    private List<FlowStep> steps = new ArrayList<>();

    @Builder.Default
    private FlowStatus status = FlowStatus.PENDING;

    private Instant createdAt;
    private Instant updatedAt;
}
