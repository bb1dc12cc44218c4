package com.demoBank.atmDemo.flow.dto;

import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.intent.dto.IntentView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Interrupted flow together with the intent it left resumable.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterruptResult {
    private ScreenFlow flow;
    private IntentView intent;
}
