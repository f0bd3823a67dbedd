package com.freightbid.auction.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Driver report on a matched shipment: pickup, delivery or inability to fulfil. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportRequest {

    @NotBlank
    private String driverId;

    private String reason;
}
