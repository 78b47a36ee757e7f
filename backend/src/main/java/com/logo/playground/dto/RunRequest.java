package com.logo.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RunRequest(
    @NotBlank(message = "Script cannot be blank")
    @Size(max = 10000, message = "Script cannot exceed 10,000 characters")
    String script
) {

    public String sanitizedScript() {
        if (script == null) {
            return "";
        }

        return script
            .trim()
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
