package com.lendpool.api.dto;

import jakarta.validation.constraints.NotNull;

public record SwitchRequest(
        @NotNull(message = "INVALID_REQUEST")
        Boolean enabled
) {
}
