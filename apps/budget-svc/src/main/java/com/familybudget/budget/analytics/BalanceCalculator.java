package com.familybudget.budget.analytics;

import com.familybudget.budget.model.Balance;
import java.math.BigDecimal;
import java.time.YearMonth;
import org.springframework.stereotype.Component;

@Component
public class BalanceCalculator {

    /**
     * Savings rate is the balance as a share of income, and zero when there is no income.
     */
    public Balance calculate(YearMonth month, BigDecimal incomeTotal, BigDecimal expenseTotal) {
        BigDecimal income = Ratios.money(incomeTotal);
        BigDecimal expenses = Ratios.money(expenseTotal);
        BigDecimal balance = income.subtract(expenses);
        return new Balance(month, income, expenses, balance, Ratios.percentOf(balance, income));
    }
}
