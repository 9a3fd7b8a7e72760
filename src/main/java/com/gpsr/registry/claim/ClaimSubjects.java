package com.gpsr.registry.claim;

import com.gpsr.registry.error.NotFoundException;
import com.gpsr.registry.store.Table;
import com.gpsr.registry.store.Transaction;

import static com.gpsr.registry.schema.RegistrySchema.ADDRESSES;
import static com.gpsr.registry.schema.RegistrySchema.BRANDS;
import static com.gpsr.registry.schema.RegistrySchema.CONTACTS;
import static com.gpsr.registry.schema.RegistrySchema.ENTITIES;
import static com.gpsr.registry.schema.RegistrySchema.PRODUCTS;
import static com.gpsr.registry.schema.RegistrySchema.RESPONSIBILITIES;

/**
 * Referential integrity for the tagged {@code (subject, subjectId)} reference of a
 * claim. There is no foreign key per subject kind, so existence is checked against
 * the subject's own table when the claim is written.
 */
final class ClaimSubjects {

    private ClaimSubjects() {
    }

    static Table<?> tableOf(ClaimSubject subject) {
        return switch (subject) {
            case ENTITY -> ENTITIES;
            case BRAND -> BRANDS;
            case PRODUCT -> PRODUCTS;
            case RESPONSIBILITY -> RESPONSIBILITIES;
            case CONTACT -> CONTACTS;
            case ADDRESS -> ADDRESSES;
        };
    }

    /**
     * @throws NotFoundException if the subject row is not visible to the transaction
     */
    static void requireExists(Transaction tx, ClaimSubject subject, String subjectId) {
        Table<?> table = tableOf(subject);
        if (!tx.exists(table, subjectId)) {
            throw new NotFoundException(table.resource(), subjectId);
        }
    }
}
