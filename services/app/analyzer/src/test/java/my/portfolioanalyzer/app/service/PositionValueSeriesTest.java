package my.portfolioanalyzer.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.portfolioanalyzer.app.model.PriceQuote;
import my.portfolioanalyzer.app.model.ValuePoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PositionValueSeriesTest {
	@Test
	void buildsDateOrderedSeriesForHeldSymbolsOnly() throws Exception {
		Path history = Path.of(getClass().getClassLoader().getResource("prices/history.json").toURI());
		List<PriceQuote> quotes = new PriceHistoryLoader(new ObjectMapper()).load(history);

		Map<String, List<ValuePoint>> series = PositionValueSeries.build(Map.of("MSFT", 10, "GOOGL", 2), quotes);

		assertThat(series).containsOnlyKeys("MSFT", "GOOGL");
		assertThat(series.keySet()).containsExactly("MSFT", "GOOGL");

		List<ValuePoint> msft = series.get("MSFT");
		assertThat(msft).extracting(ValuePoint::date).containsExactly(
				LocalDate.of(2017, 7, 26), LocalDate.of(2017, 7, 27), LocalDate.of(2017, 7, 28));
		assertThat(msft.get(0).value()).isEqualByComparingTo("740.50");
		assertThat(msft.get(2).value()).isEqualByComparingTo("730.40");

		List<ValuePoint> googl = series.get("GOOGL");
		assertThat(googl).hasSize(3);
		assertThat(googl.get(0).value()).isEqualByComparingTo("1930.62");
		assertThat(googl.get(2).value()).isEqualByComparingTo("1883.06");
	}

	@Test
	void parsesMonthCaseInsensitivelyAndMapsTwoDigitYears() {
		List<PriceQuote> quotes = List.of(
				new PriceQuote("M", "5-MAR-19", "10"),
				new PriceQuote("M", "31-dec-68", "11"),
				new PriceQuote("M", "1-Jan-69", "12"),
				new PriceQuote("M", "31-Feb-19", "13")
		);

		List<ValuePoint> points = PositionValueSeries.build(Map.of("M", 1), quotes).get("M");

		assertThat(points).extracting(ValuePoint::date).containsExactly(
				LocalDate.of(1969, 1, 1), LocalDate.of(2019, 3, 5), LocalDate.of(2068, 12, 31));
	}

	@Test
	void nonScalarValuesOnlyDropTheirOwnRecord(@TempDir Path tempDir) throws Exception {
		Path history = Files.writeString(tempDir.resolve("history.json"), """
				[
				  {"Symbol": "MSFT", "Date": "26-Jul-17", "Close": {"v": 1}},
				  {"Symbol": "MSFT", "Date": "27-Jul-17", "Close": "73.16"},
				  42
				]
				""");

		List<PriceQuote> quotes = new PriceHistoryLoader(new ObjectMapper()).load(history);

		assertThat(quotes).containsExactly(
				new PriceQuote("MSFT", "26-Jul-17", null),
				new PriceQuote("MSFT", "27-Jul-17", "73.16"));
		List<ValuePoint> points = PositionValueSeries.build(Map.of("MSFT", 10), quotes).get("MSFT");
		assertThat(points).singleElement().satisfies(point -> {
			assertThat(point.date()).isEqualTo(LocalDate.of(2017, 7, 27));
			assertThat(point.value()).isEqualByComparingTo("731.60");
		});
	}

	@Test
	void returnsNoSeriesWhenNothingIsHeld() {
		List<PriceQuote> quotes = List.of(new PriceQuote("AAPL", "26-Jul-17", "153.46"));

		assertThat(PositionValueSeries.build(Map.of(), quotes)).isEmpty();
	}
}
