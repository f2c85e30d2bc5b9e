package com.edgeauth.auth.dto.response;

import com.edgeauth.auth.domain.User;
import com.fasterxml.jackson.annotation.JsonProperty;

public record UserResponse(
        String id,
        String email,
        String name,
        @JsonProperty("is_admin") boolean admin
) {
    public static UserResponse from(User user) {
        return new UserResponse(
                String.valueOf(user.getId()),
                user.getEmail(),
                user.getName(),
                user.isAdmin()
        );
    }
}
