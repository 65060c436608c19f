package com.algoanalytics.reporting;

import com.algoanalytics.exception.ValidationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Buy-and-hold baseline: 100% of initial capital in one symbol at the start price, held to
 * the end price. Used to judge whether a strategy beat simply holding its benchmark.
 */
@Slf4j
@Component
public class BaselineCalculator {

    private static final double DAYS_PER_YEAR = 365.25;

    /** Periods shorter than this (about four days) are not annualized. */
    private static final double MIN_ANNUALIZABLE_YEARS = 0.01;

    /**
     * @return the baseline, or empty if either price is not positive
     * @throws ValidationException if initial capital is missing or not positive
     */
    public Optional<BaselineResult> calculate(
            String symbol,
            BigDecimal startPrice,
            BigDecimal endPrice,
            LocalDateTime start,
            LocalDateTime end,
            BigDecimal initialCapital) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new ValidationException("initial capital must be positive: " + initialCapital);
        }
        if (startPrice == null || endPrice == null || startPrice.signum() <= 0 || endPrice.signum() <= 0) {
            log.warn("Invalid prices for baseline {}: start={}, end={}", symbol, startPrice, endPrice);
            return Optional.empty();
        }

        BigDecimal shares = initialCapital.divide(startPrice, MathContext.DECIMAL128);
        BigDecimal finalValue = shares.multiply(endPrice, MathContext.DECIMAL128);
        double totalReturn = finalValue
                .subtract(initialCapital)
                .divide(initialCapital, MathContext.DECIMAL128)
                .doubleValue();

        long days = ChronoUnit.DAYS.between(start, end);
        double years = days / DAYS_PER_YEAR;
        double annualizedReturn;
        if (years < MIN_ANNUALIZABLE_YEARS) {
            log.debug("Short baseline period ({} days), reporting total return as annualized", days);
            annualizedReturn = totalReturn;
        } else {
            annualizedReturn = Math.pow(1.0 + totalReturn, 1.0 / years) - 1.0;
        }

        log.info("Baseline ({}): {} total, {} annualized over {} days", symbol, totalReturn, annualizedReturn, days);

        return Optional.of(BaselineResult.builder()
                .symbol(symbol)
                .finalValue(finalValue)
                .totalReturn(totalReturn)
                .annualizedReturn(annualizedReturn)
                .build());
    }
}
