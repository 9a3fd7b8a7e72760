package com.gpsr.registry.product;

import java.util.List;

/**
 * Safety content of a product for one market and language. On update, null
 * fields keep their current value.
 *
 * @param ageRestriction minimum age in years, or null
 * @param hazardSymbols  GHS or pictogram codes shown on the product
 */
public record SafetyContent(
        String warningText,
        String safetyInstructions,
        Integer ageRestriction,
        List<String> hazardSymbols,
        String documentUrl,
        DocumentType documentType
) {
    public SafetyContent {
        hazardSymbols = hazardSymbols != null ? List.copyOf(hazardSymbols) : null;
        if (ageRestriction != null && ageRestriction < 0) {
            throw new IllegalArgumentException("ageRestriction must be >= 0");
        }
    }

    public static SafetyContent warning(String warningText) {
        return new SafetyContent(warningText, null, null, null, null, null);
    }

    /**
     * Returns this content with every null field taken from {@code base}.
     */
    public SafetyContent mergedOnto(SafetyContent base) {
        return new SafetyContent(
                warningText != null ? warningText : base.warningText,
                safetyInstructions != null ? safetyInstructions : base.safetyInstructions,
                ageRestriction != null ? ageRestriction : base.ageRestriction,
                hazardSymbols != null ? hazardSymbols : base.hazardSymbols,
                documentUrl != null ? documentUrl : base.documentUrl,
                documentType != null ? documentType : base.documentType);
    }
}
