package com.example.jobscheduler.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToggleJobRequest {

    @NotNull(message = "enabled (boolean) is required")
    private Boolean enabled;
}
