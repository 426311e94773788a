package com.familybudget.budget.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.familybudget.budget.model.Balance;
import java.math.BigDecimal;
import java.time.YearMonth;
import org.junit.jupiter.api.Test;

class BalanceCalculatorTest {

    private final BalanceCalculator calculator = new BalanceCalculator();

    @Test
    void savingsRateIsShareOfIncome() {
        Balance balance = calculator.calculate(YearMonth.of(2024, 3), new BigDecimal("5000"), new BigDecimal("4000"));

        assertThat(balance.balance()).isEqualByComparingTo("1000.00");
        assertThat(balance.savingsRate()).isEqualByComparingTo("20.00");
    }

    @Test
    void overspendingGivesNegativeRate() {
        Balance balance = calculator.calculate(YearMonth.of(2024, 3), new BigDecimal("2000"), new BigDecimal("2500"));

        assertThat(balance.balance()).isEqualByComparingTo("-500.00");
        assertThat(balance.savingsRate()).isEqualByComparingTo("-25.00");
    }

    @Test
    void noIncomeMeansZeroRate() {
        Balance balance = calculator.calculate(YearMonth.of(2024, 3), BigDecimal.ZERO, new BigDecimal("300"));

        assertThat(balance.balance()).isEqualByComparingTo("-300.00");
        assertThat(balance.savingsRate()).isEqualByComparingTo("0.00");
    }
}
