package my.portfolioanalyzer.app.service.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public final class InvestmentMetrics {
	public static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365.25");
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
	private static final MathContext PRECISION = MathContext.DECIMAL64;

	private InvestmentMetrics() {
	}

	public static BigDecimal earnings(BigDecimal currentPrice, BigDecimal purchasePrice, int quantity) {
		return currentPrice.subtract(purchasePrice).multiply(BigDecimal.valueOf(quantity));
	}

	/**
	 * Price appreciation in percent. Throws {@link ArithmeticException} when the purchase price is zero.
	 */
	public static BigDecimal percentageYield(BigDecimal currentPrice, BigDecimal purchasePrice) {
		return currentPrice.subtract(purchasePrice)
				.divide(purchasePrice, PRECISION)
				.multiply(HUNDRED);
	}

	/**
	 * Total return annualized over the exact holding period (days / 365.25).
	 * A holding period of zero or less yields exactly zero.
	 */
	public static BigDecimal yearlyReturn(BigDecimal currentPrice, BigDecimal purchasePrice,
										  LocalDate purchaseDate, LocalDate asOf) {
		BigDecimal yearsHeld = yearsHeld(purchaseDate, asOf);
		if (yearsHeld.signum() <= 0) {
			return BigDecimal.ZERO;
		}
		BigDecimal totalReturn = currentPrice.subtract(purchasePrice).divide(purchasePrice, PRECISION);
		return totalReturn.divide(yearsHeld, PRECISION).multiply(HUNDRED);
	}

	public static BigDecimal yearsHeld(LocalDate purchaseDate, LocalDate asOf) {
		long days = ChronoUnit.DAYS.between(purchaseDate, asOf);
		return BigDecimal.valueOf(days).divide(DAYS_PER_YEAR, PRECISION);
	}
}
