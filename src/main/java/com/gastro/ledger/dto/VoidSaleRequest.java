package com.gastro.ledger.dto;

import com.gastro.ledger.model.VoidReason;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class VoidSaleRequest {

    @NotNull(message = "Void reason is required")
    private VoidReason reason;

    @Size(max = 255, message = "Notes cannot exceed 255 characters")
    private String notes;
}
