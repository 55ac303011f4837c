package com.entity.intelligence.rules;

import java.util.List;

import static com.entity.intelligence.core.model.EntityKind.COMPANY;
import static com.entity.intelligence.rules.NormalizationRule.stripping;

/**
 * Built-in normalization rules used by enrichment and the search index.
 */
public final class DefaultNormalizationRules {

    private static final int SUFFIX_PRIORITY = 10;
    private static final int LEGAL_FORM_PRIORITY = 20;

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine with the company suffix rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(companyRules());
    }

    /**
     * Studio words and legal forms stripped from company names.
     */
    public static List<NormalizationRule> companyRules() {
        return List.of(
                stripping("company-pictures", "\\s*\\bpictures\\b", SUFFIX_PRIORITY, COMPANY),
                stripping("company-studios", "\\s*\\bstudios\\b", SUFFIX_PRIORITY, COMPANY),
                stripping("company-entertainment", "\\s*\\bentertainment\\b", SUFFIX_PRIORITY, COMPANY),
                stripping("company-productions", "\\s*\\bproductions\\b", SUFFIX_PRIORITY, COMPANY),
                stripping("company-films", "\\s*\\bfilms\\b", SUFFIX_PRIORITY, COMPANY),
                stripping("company-media", "\\s*\\bmedia\\b", SUFFIX_PRIORITY, COMPANY),
                stripping("company-inc", ",?\\s*\\binc\\.", LEGAL_FORM_PRIORITY, COMPANY),
                stripping("company-llc", ",?\\s*\\bllc\\b", LEGAL_FORM_PRIORITY, COMPANY),
                stripping("company-ltd", ",?\\s*\\bltd\\.", LEGAL_FORM_PRIORITY, COMPANY));
    }
}
