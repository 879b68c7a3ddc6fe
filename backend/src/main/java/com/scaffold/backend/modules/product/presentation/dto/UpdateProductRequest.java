package com.scaffold.backend.modules.product.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateProductRequest(
        @Size(min = 1, max = 255) String name,
        @DecimalMin(value = "0", inclusive = false) BigDecimal quantity,
        @Size(min = 1, max = 10) String unit,
        @DecimalMin(value = "0") BigDecimal price,
        @Size(min = 3, max = 3) String currency,
        Boolean isActive
) {
}
