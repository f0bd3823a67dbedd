package com.freightbid.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.freightbid.shared.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raised when a load fails after pickup and needs manual intervention by ops.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchEscalationEvent {

    public static final String TOPIC = "dispatch.escalation";

    private String matchId;
    private String shipmentId;
    private String shipperId;
    private String driverId;
    private ExecutionStatus lastExecutionStatus;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant raisedAt;
}
