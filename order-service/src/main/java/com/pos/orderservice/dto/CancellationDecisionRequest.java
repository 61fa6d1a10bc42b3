package com.pos.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancellationDecisionRequest {
    @NotNull(message = "Decision cannot be null")
    private Boolean approved;

    @Size(max = 500, message = "Admin notes must be at most 500 characters")
    private String adminNotes;
}
