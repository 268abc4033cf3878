package my.portfolioanalyzer.app.util;

import org.apache.commons.csv.CSVFormat;

public final class CsvParsing {
	/**
	 * Comma-separated, no header, no quoting, trimmed values. Empty lines are kept as one-field records so
	 * that record numbers stay equal to line numbers.
	 */
	public static final CSVFormat HOLDING_LINES = CSVFormat.DEFAULT.builder()
			.setIgnoreEmptyLines(false)
			.setQuote(null)
			.setTrim(true)
			.build();

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}
}
