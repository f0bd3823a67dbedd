package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reputation formula with default constants:
 *   score = (onTime + 0.5*late + 2) / (onTime + late + 0.25*pre + 1.0*post + 2.0*pickup + 4)
 */
class ReputationCalculatorTest {

    private ReputationCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new ReputationCalculator(new AuctionProperties());
    }

    @Test
    @DisplayName("A driver with no history is neutral (0.5)")
    void neutralWithoutHistory() {
        assertThat(calculator.score(0, 0, 0, 0, 0)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Any cancellation strictly lowers the score")
    void cancellationsLowerScore() {
        double base = calculator.score(3, 1, 0, 0, 0);
        assertThat(calculator.score(3, 1, 1, 0, 0)).isLessThan(base);
        assertThat(calculator.score(3, 1, 0, 1, 0)).isLessThan(base);
        assertThat(calculator.score(3, 1, 0, 0, 1)).isLessThan(base);
    }

    @Test
    @DisplayName("Later cancellation stages weigh more: pre-match < post-match < post-pickup")
    void laterStagesPenaliseMore() {
        double pre = calculator.score(2, 0, 1, 0, 0);
        double post = calculator.score(2, 0, 0, 1, 0);
        double pickup = calculator.score(2, 0, 0, 0, 1);
        assertThat(pre).isGreaterThan(post);
        assertThat(post).isGreaterThan(pickup);
    }

    @Test
    @DisplayName("An on-time completion strictly raises the score, a late one less so")
    void completionsRaiseScore() {
        double base = calculator.score(1, 1, 1, 1, 0);
        double onTime = calculator.score(2, 1, 1, 1, 0);
        double late = calculator.score(1, 2, 1, 1, 0);
        assertThat(onTime).isGreaterThan(base);
        assertThat(onTime).isGreaterThan(late);
    }

    @Test
    @DisplayName("Score stays strictly inside (0,1) for extreme histories")
    void boundedForExtremes() {
        assertThat(calculator.score(10_000, 0, 0, 0, 0)).isLessThan(1.0).isGreaterThan(0.99);
        assertThat(calculator.score(0, 0, 0, 0, 10_000)).isGreaterThan(0.0).isLessThan(0.01);
    }

    @Test
    @DisplayName("Stored score uses a 0-100 scale")
    void storedScale() {
        assertThat(ReputationCalculator.toStored(0.5)).isEqualTo(50.0);
        assertThat(ReputationCalculator.toStored(0.123)).isEqualTo(12.3);
    }
}
