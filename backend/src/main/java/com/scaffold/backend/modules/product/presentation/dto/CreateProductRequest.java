package com.scaffold.backend.modules.product.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateProductRequest(
        @NotBlank(message = "name is required") @Size(max = 255) String name,
        @NotNull(message = "quantity is required") @DecimalMin(value = "0", inclusive = false) BigDecimal quantity,
        @NotBlank(message = "unit is required") @Size(max = 10) String unit,
        @NotNull(message = "price is required") @DecimalMin(value = "0", inclusive = false) BigDecimal price,
        @NotBlank(message = "currency is required") @Size(min = 3, max = 3) String currency,
        Boolean isActive
) {
}
