package com.lendrisk.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RegisterUserRequest {
    /** Wallet address, 0x + 40 hex chars. */
    @NotBlank
    private String accountAddress;
}
