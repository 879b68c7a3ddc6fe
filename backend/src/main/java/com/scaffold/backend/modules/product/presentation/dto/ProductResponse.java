package com.scaffold.backend.modules.product.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import com.scaffold.backend.modules.product.domain.Product;

public record ProductResponse(
        Long id,
        String name,
        BigDecimal quantity,
        String unit,
        BigDecimal price,
        String currency,
        boolean isActive,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ProductResponse from(Product product) {
        return new ProductResponse(
                product.getId(),
                product.getName(),
                product.getQuantity(),
                product.getUnit(),
                product.getPrice(),
                product.getCurrency(),
                product.isActive(),
                product.getCreatedAt(),
                product.getUpdatedAt()
        );
    }
}
