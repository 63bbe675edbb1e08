package com.gastro.ledger.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CloseDayRequest {

    @NotNull(message = "Closing inventory is required")
    @Valid
    private List<SnapshotEntry> closingInventory = new ArrayList<>();

    @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
    private String notes;
}
