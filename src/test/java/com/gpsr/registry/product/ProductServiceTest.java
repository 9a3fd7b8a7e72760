package com.gpsr.registry.product;

import com.gpsr.registry.TestRegistry;
import com.gpsr.registry.api.Page;
import com.gpsr.registry.api.PageRequest;
import com.gpsr.registry.audit.AuditAction;
import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductService")
class ProductServiceTest {

    private TestRegistry fixture;
    private ProductService products;
    private String brandId;

    @BeforeEach
    void setUp() {
        fixture = new TestRegistry();
        products = fixture.registry.products();
        brandId = fixture.brand("Acme Toys").getId();
    }

    @Test
    @DisplayName("Should create an active product under an existing brand")
    void create() {
        Product product = products.create(ProductInput.of(brandId, "  Wooden train ").withEan("5901234123457"));

        assertEquals("Wooden train", product.productName());
        assertTrue(product.active());
        assertEquals(fixture.clock.instant(), product.createdAt());
        assertEquals(product, products.findByCode(" 5901234123457 ").orElseThrow());
        assertEquals(1, fixture.registry.audit().getForEntity(ProductService.RESOURCE, product.id(), PageRequest.first(10))
                .totalElements());
    }

    @Test
    @DisplayName("Should reject a missing brand or name")
    void validation() {
        assertThrows(NotFoundException.class, () -> products.create(ProductInput.of("missing", "Train")));
        assertThrows(ValidationException.class, () -> products.create(ProductInput.of(null, "Train")));
        assertThrows(ValidationException.class, () -> products.create(ProductInput.of(brandId, " ")));
        assertThrows(NotFoundException.class, () -> products.getById("missing"));
    }

    @Test
    @DisplayName("Should keep fields the update leaves null")
    void update() {
        Product product = products.create(ProductInput.of(brandId, "Wooden train").withEan("5901234123457"));
        fixture.tick();

        Product updated = products.update(product.id(), new ProductInput(null, "Wooden train set", null, null,
                "MPN-1", null, null, null, null, null, false));

        assertEquals("Wooden train set", updated.productName());
        assertEquals("5901234123457", updated.ean());
        assertEquals("MPN-1", updated.mpn());
        assertFalse(updated.active());
        assertEquals(product.createdAt(), updated.createdAt());
        assertTrue(products.findByCode("MPN-1").isEmpty());
        assertEquals(1, fixture.registry.audit().getEntriesByAction(AuditAction.UPDATE).size());
    }

    @Test
    @DisplayName("Should list active products by name with brand and search filters")
    void list() {
        String otherBrand = fixture.brand("Other").getId();
        products.create(ProductInput.of(brandId, "Wooden train"));
        products.create(ProductInput.of(brandId, "ball"));
        products.create(ProductInput.of(otherBrand, "Train track"));

        Page<Product> acme = products.list(brandId, null, null);
        Page<Product> trains = products.list(null, "TRAIN", PageRequest.first(1));

        assertEquals(2, acme.totalElements());
        assertEquals("ball", acme.content().get(0).productName());
        assertEquals(2, trains.totalElements());
        assertEquals(1, trains.numberOfElements());
        assertEquals("Train track", trains.content().get(0).productName());
        assertTrue(trains.hasNext());
    }
}
