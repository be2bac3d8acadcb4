package com.flagship.course_payments.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CatalogProductRepository extends JpaRepository<CatalogProduct, UUID> {

    Optional<CatalogProduct> findByIdAndType(UUID id, ProductType type);
}
