package com.querybridge.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DatabaseRegisterRequest {
    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "JDBC URL is required")
    @Pattern(regexp = "^jdbc:.+", message = "JDBC URL must start with jdbc:")
    private String jdbcUrl;

    private String username;

    private String password;

    private boolean expandRows = false;

    private boolean impersonateUser = false;
}
