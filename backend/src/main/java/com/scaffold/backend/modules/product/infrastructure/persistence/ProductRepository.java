package com.scaffold.backend.modules.product.infrastructure.persistence;

import java.util.List;

import com.scaffold.backend.modules.product.domain.Product;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ProductRepository extends JpaRepository<Product, Long> {

    List<Product> findAllByOrderByIdAsc();
}
