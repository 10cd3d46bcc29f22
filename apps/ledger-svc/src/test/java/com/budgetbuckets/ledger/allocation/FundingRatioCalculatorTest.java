package com.budgetbuckets.ledger.allocation;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class FundingRatioCalculatorTest {

    private final FundingRatioCalculator calculator = new FundingRatioCalculator();

    @Test
    void ratioIsOneWhenPlanningFitsIncome() {
        assertThat(calculator.fundingRatio(new BigDecimal("3000"), new BigDecimal("2999.99")))
                .isEqualByComparingTo(BigDecimal.ONE);
        assertThat(calculator.fundingRatio(new BigDecimal("3000"), new BigDecimal("3000")))
                .isEqualByComparingTo(BigDecimal.ONE);
    }

    @Test
    void ratioIsOneWhenNothingIsPlanned() {
        assertThat(calculator.fundingRatio(BigDecimal.ZERO, BigDecimal.ZERO)).isEqualByComparingTo(BigDecimal.ONE);
        assertThat(calculator.fundingRatio(new BigDecimal("1000"), BigDecimal.ZERO)).isEqualByComparingTo(BigDecimal.ONE);
    }

    @Test
    void overPlanningScalesEveryBucketByIncomeOverPlanned() {
        BigDecimal income = new BigDecimal("1000");
        BigDecimal planned = new BigDecimal("1200");

        assertThat(calculator.fundingRatio(income, planned)).isEqualByComparingTo("0.833333");
        assertThat(calculator.funded(new BigDecimal("700"), income, planned)).isEqualByComparingTo("583.33");
        assertThat(calculator.funded(new BigDecimal("500"), income, planned)).isEqualByComparingTo("416.67");
    }

    @Test
    void fundedEqualsPlannedRoundedToCentsWhenNotOverPlanned() {
        BigDecimal funded = calculator.funded(new BigDecimal("123.4567"), new BigDecimal("5000"), new BigDecimal("200"));

        assertThat(funded).isEqualByComparingTo("123.46");
        assertThat(funded.scale()).isEqualTo(2);
    }

    @Test
    void noIncomeFundsNothing() {
        assertThat(calculator.fundingRatio(BigDecimal.ZERO, new BigDecimal("400"))).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(calculator.funded(new BigDecimal("400"), BigDecimal.ZERO, new BigDecimal("400")))
                .isEqualByComparingTo(BigDecimal.ZERO);
    }
}
