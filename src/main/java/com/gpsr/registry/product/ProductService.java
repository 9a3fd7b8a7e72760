package com.gpsr.registry.product;

import com.gpsr.registry.RegistryContext;
import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import static com.gpsr.registry.schema.RegistrySchema.BRANDS;
import static com.gpsr.registry.schema.RegistrySchema.PRODUCTS;

/**
 * Product references. Products are not versioned: an update replaces the row and
 * the audit log keeps the before and after state.
 */
public class ProductService {
    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    public static final String RESOURCE = "Product";

    private final RegistryContext ctx;

    public ProductService(RegistryContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @throws NotFoundException if the brand does not exist
     */
    public Product create(ProductInput input) {
        if (input.brandId() == null) {
            throw ValidationException.forField("Invalid product", "brandId", "is required");
        }
        if (input.productName() == null || input.productName().isBlank()) {
            throw ValidationException.forField("Invalid product", "productName", "is required");
        }
        return ctx.runner().execute("product.create", tx -> {
            if (!tx.exists(BRANDS, input.brandId())) {
                throw new NotFoundException("Brand", input.brandId());
            }
            Instant now = ctx.now();
            Product product = new Product(UUID.randomUUID().toString(), input.brandId(), input.productName().trim(),
                    input.ean(), input.gtin(), input.mpn(), input.modelNumber(), input.sku(),
                    input.productCategory(), input.imageUrl(), input.productUrl(),
                    input.active() == null || input.active(), now, now);
            tx.insert(PRODUCTS, product);
            ctx.audit().record(tx, AuditAction.CREATE, RESOURCE, product.id(), null, product);
            tx.afterCommit(() -> log.info("product.created productId={} brandId={}", product.id(), product.brandId()));
            return product;
        });
    }

    /**
     * Replaces the non-null fields of the product. The brand cannot change.
     */
    public Product update(String id, ProductInput input) {
        return ctx.runner().execute("product.update", tx -> {
            Product current = tx.get(PRODUCTS, id).orElseThrow(() -> new NotFoundException(RESOURCE, id));
            Product updated = new Product(id, current.brandId(),
                    input.productName() != null && !input.productName().isBlank()
                            ? input.productName().trim() : current.productName(),
                    pick(input.ean(), current.ean()),
                    pick(input.gtin(), current.gtin()),
                    pick(input.mpn(), current.mpn()),
                    pick(input.modelNumber(), current.modelNumber()),
                    pick(input.sku(), current.sku()),
                    pick(input.productCategory(), current.productCategory()),
                    pick(input.imageUrl(), current.imageUrl()),
                    pick(input.productUrl(), current.productUrl()),
                    input.active() != null ? input.active() : current.active(),
                    current.createdAt(), ctx.now());
            tx.update(PRODUCTS, updated);
            ctx.audit().record(tx, AuditAction.UPDATE, RESOURCE, id, current, updated);
            return updated;
        });
    }

    public Product getById(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException(RESOURCE, id));
    }

    public Optional<Product> findById(String id) {
        return ctx.runner().read(tx -> tx.get(PRODUCTS, id));
    }

    /**
     * Finds an active product whose EAN, GTIN or MPN equals the code.
     */
    public Optional<Product> findByCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        return ctx.runner().read(tx -> tx.findFirst(PRODUCTS, p -> p.active() && p.hasCode(trimmed)));
    }

    /**
     * Lists active products by name, optionally for one brand or matching a name fragment.
     */
    public Page<Product> list(String brandId, String search, PageRequest page) {
        String fragment = search != null ? search.toLowerCase(Locale.ROOT) : null;
        List<Product> matches = ctx.runner().read(tx -> tx.find(PRODUCTS, p -> p.active()
                        && (brandId == null || brandId.equals(p.brandId()))
                        && (fragment == null || p.productName().toLowerCase(Locale.ROOT).contains(fragment))))
                .stream()
                .sorted(Comparator.comparing(Product::productName, String.CASE_INSENSITIVE_ORDER))
                .toList();
        return Page.slice(matches, ctx.page(page));
    }

    private static String pick(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
