package com.flagship.course_payments.catalog;

import com.flagship.course_payments.exception.BusinessRuleViolationException;
import com.flagship.course_payments.exception.BusinessRuleViolationException.Rule;
import com.flagship.course_payments.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Looks up a product for checkout and prices it.
 *
 * Pricing rules:
 * - course: fees less the percentage discount, floored at zero
 * - test series: price
 * - webinar and live class: fees
 *
 * The client never supplies a price.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductCatalogService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CatalogProductRepository productRepository;
    private final EnrollmentRepository enrollmentRepository;

    /**
     * @throws ResourceNotFoundException if the product does not exist
     * @throws BusinessRuleViolationException if it is inactive, full, finished or unpriced
     */
    @Transactional(readOnly = true)
    public ProductDetails getProductDetails(ProductType type, UUID productId) {
        if (!type.isPurchasable()) {
            throw new BusinessRuleViolationException(Rule.INVALID_PRODUCT_TYPE,
                    "Product type '" + type.getWireName() + "' cannot be purchased directly");
        }

        CatalogProduct product = productRepository.findByIdAndType(productId, type)
                .orElseThrow(() -> new ResourceNotFoundException(type.getWireName(), productId));

        if (!product.isActive()) {
            throw new BusinessRuleViolationException(Rule.INACTIVE_ENTITY,
                    "Product " + productId + " is not available for purchase");
        }
        if (type == ProductType.LIVE_CLASS && product.isCompleted()) {
            throw new BusinessRuleViolationException(Rule.INACTIVE_ENTITY,
                    "Live class " + productId + " has already completed");
        }
        if (product.getSeatLimit() != null) {
            long enrolled = enrollmentRepository.countByProductTypeAndProductId(type, productId);
            if (enrolled >= product.getSeatLimit()) {
                throw new BusinessRuleViolationException(Rule.CAPACITY_EXCEEDED,
                        "Product " + productId + " has no seats left");
            }
        }

        BigDecimal price = priceOf(product);
        if (price == null || price.signum() <= 0) {
            throw new BusinessRuleViolationException(Rule.INVALID_PRICE,
                    "Product " + productId + " has no valid price");
        }
        log.debug("Priced product: productType={}, productId={}, price={}", type.getWireName(), productId, price);

        return ProductDetails.builder()
                .productId(product.getId())
                .type(type)
                .title(product.getTitle())
                .price(price)
                .snapshot(snapshotOf(product))
                .build();
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyEnrolled(UUID studentId, ProductType type, UUID productId) {
        return enrollmentRepository.existsByStudentIdAndProductTypeAndProductId(studentId, type, productId);
    }

    static BigDecimal priceOf(CatalogProduct product) {
        return switch (product.getType()) {
            case COURSE -> discountedFees(product);
            case TEST_SERIES -> product.getPrice();
            case WEBINAR, LIVE_CLASS -> product.getFees();
            case TEST -> null;
        };
    }

    private static BigDecimal discountedFees(CatalogProduct product) {
        if (product.getFees() == null) {
            return null;
        }
        BigDecimal discount = product.getDiscountPercent() != null ? product.getDiscountPercent() : BigDecimal.ZERO;
        BigDecimal reduction = product.getFees().multiply(discount).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return product.getFees().subtract(reduction).max(BigDecimal.ZERO);
    }

    private static ProductSnapshot snapshotOf(CatalogProduct product) {
        ProductSnapshot.ProductSnapshotBuilder builder = ProductSnapshot.builder()
                .title(product.getTitle())
                .description(product.getDescription())
                .educatorId(product.getEducatorId());

        switch (product.getType()) {
            case COURSE -> builder.fees(product.getFees()).discount(product.getDiscountPercent());
            case TEST_SERIES -> builder.price(product.getPrice()).numberOfTests(product.getNumberOfTests());
            case WEBINAR, LIVE_CLASS -> builder.fees(product.getFees()).timing(product.getTiming());
            case TEST -> { }
        }
        return builder.build();
    }
}
