package com.demoBank.atmDemo.flow.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FlowStep {
    String id;
    String label;
    StepType type;
}
