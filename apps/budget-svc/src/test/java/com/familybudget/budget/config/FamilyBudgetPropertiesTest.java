package com.familybudget.budget.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class FamilyBudgetPropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        FamilyBudgetProperties props = new FamilyBudgetProperties(null, null);

        assertEquals(6, props.analytics().forecastLookbackMonths());
        assertEquals(3, props.analytics().anomalyLookbackMonths());
        assertEquals(2.0d, props.analytics().anomalyThreshold());
        assertEquals(List.of("Housing", "Insurance", "Loans"), props.analytics().essentialCategories());
        assertEquals(0, BigDecimal.TEN.compareTo(props.analytics().savingsRateTarget()));
        assertFalse(props.security().hasJwtSecret());
    }

    @Test
    void emptyEssentialListIsKept() {
        FamilyBudgetProperties.Analytics analytics = new FamilyBudgetProperties.Analytics(null, null, null, List.of(), null);

        assertTrue(analytics.essentialCategorySet().isEmpty());
    }

    @Test
    void rejectsForecastLookbackBelowMinimumHistory() {
        assertThrows(IllegalArgumentException.class,
                () -> new FamilyBudgetProperties.Analytics(2, null, null, null, null));
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new FamilyBudgetProperties.Analytics(null, null, 0d, null, null));
    }

    @Test
    void rejectsSavingsTargetAboveHundred() {
        assertThrows(IllegalArgumentException.class,
                () -> new FamilyBudgetProperties.Analytics(null, null, null, null, new BigDecimal("101")));
    }

    @Test
    void blankSecretCountsAsMissing() {
        FamilyBudgetProperties props = new FamilyBudgetProperties(null, new FamilyBudgetProperties.Security("  "));

        assertFalse(props.security().hasJwtSecret());
    }
}
