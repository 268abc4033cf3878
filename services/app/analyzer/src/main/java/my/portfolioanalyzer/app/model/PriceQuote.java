package my.portfolioanalyzer.app.model;

/**
 * One entry of the price history file. Values are kept as text and validated when the series are built;
 * a value that was not a JSON scalar is null.
 */
public record PriceQuote(
		String symbol,
		String date,
		String close
) {
}
