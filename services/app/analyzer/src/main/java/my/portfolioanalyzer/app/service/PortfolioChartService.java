package my.portfolioanalyzer.app.service;

import my.portfolioanalyzer.app.domain.Investment;
import my.portfolioanalyzer.app.model.PriceQuote;
import my.portfolioanalyzer.app.model.ValuePoint;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.data.time.Day;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class PortfolioChartService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioChartService.class);
	private static final String TITLE = "Portfolio Value Over Time";
	private static final int WIDTH = 1000;
	private static final int HEIGHT = 600;

	private final PriceHistoryLoader priceHistoryLoader;

	public PortfolioChartService(PriceHistoryLoader priceHistoryLoader) {
		this.priceHistoryLoader = priceHistoryLoader;
	}

	/**
	 * Held quantity per symbol; a symbol held more than once keeps the quantity of its last holding.
	 */
	public static Map<String, Integer> quantitiesBySymbol(List<? extends Investment> stocks) {
		Map<String, Integer> quantities = new LinkedHashMap<>();
		for (Investment stock : stocks) {
			quantities.put(stock.getSymbol(), stock.getQuantity());
		}
		return quantities;
	}

	public boolean visualize(Path priceHistory, Map<String, Integer> quantities, Path output) {
		try {
			List<PriceQuote> quotes = priceHistoryLoader.load(priceHistory);
			Map<String, List<ValuePoint>> series = PositionValueSeries.build(quantities, quotes);
			render(series, output);
			logger.info("Saved {} ({} series)", output, series.size());
			return true;
		} catch (IOException | RuntimeException exc) {
			logger.error("Visualization failed: {}", exc.getMessage());
			return false;
		}
	}

	void render(Map<String, List<ValuePoint>> series, Path output) throws IOException {
		TimeSeriesCollection dataset = new TimeSeriesCollection();
		for (Map.Entry<String, List<ValuePoint>> entry : series.entrySet()) {
			TimeSeries timeSeries = new TimeSeries(entry.getKey());
			for (ValuePoint point : entry.getValue()) {
				Day day = new Day(point.date().getDayOfMonth(), point.date().getMonthValue(), point.date().getYear());
				timeSeries.addOrUpdate(day, point.value().doubleValue());
			}
			dataset.addSeries(timeSeries);
		}
		JFreeChart chart = ChartFactory.createTimeSeriesChart(TITLE, "Date", "Value", dataset, true, false, false);
		ChartUtils.saveChartAsPNG(output.toFile(), chart, WIDTH, HEIGHT);
	}
}
