package com.scaffold.backend.modules.product.application;

import java.util.List;
import java.util.Locale;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.product.domain.Product;
import com.scaffold.backend.modules.product.infrastructure.persistence.ProductRepository;
import com.scaffold.backend.modules.product.presentation.dto.CreateProductRequest;
import com.scaffold.backend.modules.product.presentation.dto.ProductResponse;
import com.scaffold.backend.modules.product.presentation.dto.UpdateProductRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProductService {

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Transactional(readOnly = true)
    public List<ProductResponse> findAll() {
        return productRepository.findAllByOrderByIdAsc().stream()
                .map(ProductResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public ProductResponse findOne(Long id) {
        return ProductResponse.from(load(id));
    }

    public ProductResponse create(CreateProductRequest request) {
        Product product = new Product();
        product.setName(request.name().trim());
        product.setQuantity(request.quantity());
        product.setUnit(request.unit().trim());
        product.setPrice(request.price());
        product.setCurrency(request.currency().toUpperCase(Locale.ROOT));
        product.setActive(request.isActive() == null || request.isActive());
        return ProductResponse.from(productRepository.saveAndFlush(product));
    }

    public ProductResponse update(Long id, UpdateProductRequest request) {
        Product product = load(id);
        if (request.name() != null) {
            product.setName(request.name().trim());
        }
        if (request.quantity() != null) {
            product.setQuantity(request.quantity());
        }
        if (request.unit() != null) {
            product.setUnit(request.unit().trim());
        }
        if (request.price() != null) {
            product.setPrice(request.price());
        }
        if (request.currency() != null) {
            product.setCurrency(request.currency().toUpperCase(Locale.ROOT));
        }
        if (request.isActive() != null) {
            product.setActive(request.isActive());
        }
        return ProductResponse.from(productRepository.saveAndFlush(product));
    }

    public void delete(Long id) {
        productRepository.delete(load(id));
    }

    private Product load(Long id) {
        return productRepository.findById(id)
                .orElseThrow(() -> ProblemException.notFound("PRODUCT_NOT_FOUND", "Product with ID " + id + " not found"));
    }
}
