package com.edgeauth.auth.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

// admin flag and password are not user-editable here
public record UpdateProfileRequest(
        @NotBlank @Email String email,
        @NotBlank @Size(max = 50) String name
) {
}
