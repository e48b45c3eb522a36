package com.lendrisk.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ReassignHolderRequest {
    @NotBlank
    private String currentHolderId;
    @NotBlank
    private String newHolderId;
}
