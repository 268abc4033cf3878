package my.portfolioanalyzer.app.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A fixed-income position. Earnings add a yield-based income term to the capital gain;
 * percent yield and yearly return stay price-only.
 */
public class Bond extends Investment {
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private final BigDecimal coupon;
	private final BigDecimal yieldRate;

	public Bond(String purchaseId, String symbol, int quantity, BigDecimal purchasePrice, BigDecimal currentPrice,
				BigDecimal coupon, BigDecimal yieldRate, LocalDate purchaseDate) {
		super(purchaseId, symbol, quantity, purchasePrice, currentPrice, purchaseDate);
		this.coupon = Objects.requireNonNull(coupon, "coupon");
		this.yieldRate = Objects.requireNonNull(yieldRate, "yieldRate");
	}

	public static Bond fromText(String purchaseId, String symbol, String quantity, String purchasePrice,
								String currentPrice, String coupon, String yieldRate, String purchaseDate) {
		return new Bond(purchaseId, symbol, parseQuantity(quantity), parseDecimal(purchasePrice),
				parseDecimal(currentPrice), parseDecimal(coupon), parseYieldRate(yieldRate),
				parsePurchaseDate(purchaseDate));
	}

	@Override
	public BigDecimal earnings() {
		BigDecimal income = BigDecimal.valueOf(getQuantity())
				.multiply(getPurchasePrice())
				.multiply(yieldRate);
		return super.earnings().add(income);
	}

	public BigDecimal getCoupon() {
		return coupon;
	}

	public BigDecimal getYieldRate() {
		return yieldRate;
	}

	/**
	 * "1.35%" becomes 0.0135. The value is divided by 100 whether or not a percent sign is present.
	 */
	public static BigDecimal parseYieldRate(String raw) {
		String value = requireText(raw, "yield rate");
		int start = 0;
		int end = value.length();
		while (start < end && value.charAt(start) == '%') {
			start++;
		}
		while (end > start && value.charAt(end - 1) == '%') {
			end--;
		}
		return new BigDecimal(value.substring(start, end).trim()).divide(HUNDRED);
	}
}
