package com.pos.orderservice.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancellationRequest {
    // Blank reasons are rejected by the workflow with EMPTY_REASON
    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;
}
