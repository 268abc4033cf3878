package my.portfolioanalyzer.app.domain;

import my.portfolioanalyzer.app.service.util.InvestmentMetrics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * A purchased equity position. Instances are immutable; all metrics are derived on access.
 */
public class Investment {
	public static final DateTimeFormatter PURCHASE_DATE_INPUT = DateTimeFormatter.ofPattern("M/d/uuuu", Locale.ROOT)
			.withResolverStyle(ResolverStyle.STRICT);
	public static final DateTimeFormatter PURCHASE_DATE_OUTPUT = DateTimeFormatter.ofPattern("MM/dd/uuuu", Locale.ROOT);

	private final String purchaseId;
	private final String symbol;
	private final int quantity;
	private final BigDecimal purchasePrice;
	private final BigDecimal currentPrice;
	private final LocalDate purchaseDate;

	public Investment(String purchaseId, String symbol, int quantity, BigDecimal purchasePrice,
					  BigDecimal currentPrice, LocalDate purchaseDate) {
		this.purchaseId = Objects.requireNonNull(purchaseId, "purchaseId");
		this.symbol = Objects.requireNonNull(symbol, "symbol");
		this.quantity = quantity;
		this.purchasePrice = Objects.requireNonNull(purchasePrice, "purchasePrice");
		this.currentPrice = Objects.requireNonNull(currentPrice, "currentPrice");
		this.purchaseDate = Objects.requireNonNull(purchaseDate, "purchaseDate");
	}

	public static Investment fromText(String purchaseId, String symbol, String quantity, String purchasePrice,
									  String currentPrice, String purchaseDate) {
		return new Investment(purchaseId, symbol, parseQuantity(quantity), parseDecimal(purchasePrice),
				parseDecimal(currentPrice), parsePurchaseDate(purchaseDate));
	}

	public BigDecimal earnings() {
		return InvestmentMetrics.earnings(currentPrice, purchasePrice, quantity);
	}

	public BigDecimal percentYield() {
		return InvestmentMetrics.percentageYield(currentPrice, purchasePrice);
	}

	public BigDecimal yearlyReturn() {
		return yearlyReturn(LocalDate.now());
	}

	public BigDecimal yearlyReturn(LocalDate asOf) {
		return InvestmentMetrics.yearlyReturn(currentPrice, purchasePrice, purchaseDate, asOf);
	}

	public String getPurchaseId() {
		return purchaseId;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getQuantity() {
		return quantity;
	}

	public BigDecimal getPurchasePrice() {
		return purchasePrice;
	}

	public BigDecimal getCurrentPrice() {
		return currentPrice;
	}

	public LocalDate getPurchaseDate() {
		return purchaseDate;
	}

	public String getPurchaseDateText() {
		return PURCHASE_DATE_OUTPUT.format(purchaseDate);
	}

	public static int parseQuantity(String raw) {
		return Integer.parseInt(requireText(raw, "quantity"));
	}

	public static BigDecimal parseDecimal(String raw) {
		return new BigDecimal(requireText(raw, "price"));
	}

	public static LocalDate parsePurchaseDate(String raw) {
		return LocalDate.parse(requireText(raw, "purchase date"), PURCHASE_DATE_INPUT);
	}

	static String requireText(String raw, String field) {
		String value = raw == null ? "" : raw.trim();
		if (value.isEmpty()) {
			throw new NumberFormatException("Missing " + field);
		}
		return value;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + purchaseId + " " + symbol + " x" + quantity + "]";
	}
}
