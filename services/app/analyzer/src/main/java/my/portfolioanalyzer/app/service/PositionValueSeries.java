package my.portfolioanalyzer.app.service;

import my.portfolioanalyzer.app.model.PriceQuote;
import my.portfolioanalyzer.app.model.ValuePoint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns closing prices into position values (close x held quantity), one date-ordered series per held symbol.
 */
public final class PositionValueSeries {
	// "05-Mar-19"; two-digit years resolve to 1969..2068
	static final DateTimeFormatter QUOTE_DATE = new DateTimeFormatterBuilder()
			.parseCaseInsensitive()
			.appendPattern("d-MMM-")
			.appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
			.toFormatter(Locale.ENGLISH)
			.withResolverStyle(ResolverStyle.STRICT);

	private PositionValueSeries() {
	}

	public static Map<String, List<ValuePoint>> build(Map<String, Integer> quantities, List<PriceQuote> quotes) {
		Map<String, List<ValuePoint>> series = new LinkedHashMap<>();
		for (PriceQuote quote : quotes) {
			if (quote == null || quote.symbol() == null) {
				continue;
			}
			Integer quantity = quantities.get(quote.symbol());
			if (quantity == null) {
				continue;
			}
			LocalDate date = parseDate(quote.date());
			BigDecimal close = parseClose(quote.close());
			if (date == null || close == null) {
				continue;
			}
			series.computeIfAbsent(quote.symbol(), key -> new ArrayList<>())
					.add(new ValuePoint(date, close.multiply(BigDecimal.valueOf(quantity))));
		}
		series.values().forEach(points -> points.sort(Comparator.comparing(ValuePoint::date)));
		return series;
	}

	private static LocalDate parseDate(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		try {
			return LocalDate.parse(raw.trim(), QUOTE_DATE);
		} catch (DateTimeParseException exc) {
			return null;
		}
	}

	private static BigDecimal parseClose(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		try {
			return new BigDecimal(raw.trim());
		} catch (NumberFormatException exc) {
			return null;
		}
	}
}
