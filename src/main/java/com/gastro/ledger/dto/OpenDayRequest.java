package com.gastro.ledger.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class OpenDayRequest {

    private LocalDate date; // defaults to today

    @NotNull(message = "Opening inventory is required")
    @Valid
    private List<SnapshotEntry> openingInventory = new ArrayList<>();

    @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
    private String notes;
}
