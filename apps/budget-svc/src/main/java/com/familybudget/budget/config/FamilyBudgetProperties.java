package com.familybudget.budget.config;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "familybudget")
public record FamilyBudgetProperties(
        Analytics analytics,
        Security security
) {

    @ConstructorBinding
    public FamilyBudgetProperties {
        if (analytics == null) {
            analytics = new Analytics(null, null, null, null, null);
        }
        // security may be null outside deployed profiles; handled via accessor
    }

    public Security security() {
        return security != null ? security : new Security(null);
    }

    public record Analytics(
            Integer forecastLookbackMonths,
            Integer anomalyLookbackMonths,
            Double anomalyThreshold,
            List<String> essentialCategories,
            BigDecimal savingsRateTarget
    ) {
        public static final List<String> DEFAULT_ESSENTIAL_CATEGORIES = List.of("Housing", "Insurance", "Loans");

        public Analytics {
            if (forecastLookbackMonths == null) {
                forecastLookbackMonths = 6;
            }
            if (forecastLookbackMonths < 3) {
                throw new IllegalArgumentException("forecastLookbackMonths must be at least 3");
            }
            if (anomalyLookbackMonths == null) {
                anomalyLookbackMonths = 3;
            }
            if (anomalyLookbackMonths <= 0) {
                throw new IllegalArgumentException("anomalyLookbackMonths must be positive");
            }
            if (anomalyThreshold == null) {
                anomalyThreshold = 2.0d;
            }
            if (anomalyThreshold.isNaN() || anomalyThreshold <= 0) {
                throw new IllegalArgumentException("anomalyThreshold must be positive");
            }
            // an explicitly empty list disables the essential-category exclusion
            essentialCategories = essentialCategories == null ? DEFAULT_ESSENTIAL_CATEGORIES : List.copyOf(essentialCategories);
            if (savingsRateTarget == null) {
                savingsRateTarget = BigDecimal.TEN;
            }
            if (savingsRateTarget.signum() < 0 || savingsRateTarget.compareTo(BigDecimal.valueOf(100)) > 0) {
                throw new IllegalArgumentException("savingsRateTarget must be between 0 and 100");
            }
        }

        public Set<String> essentialCategorySet() {
            return new LinkedHashSet<>(essentialCategories);
        }
    }

    public record Security(String jwtSecret) {
        public boolean hasJwtSecret() {
            return jwtSecret != null && !jwtSecret.isBlank();
        }
    }
}
