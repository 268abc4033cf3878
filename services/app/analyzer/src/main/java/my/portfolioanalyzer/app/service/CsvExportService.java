package my.portfolioanalyzer.app.service;

import my.portfolioanalyzer.app.domain.Investment;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Service
public class CsvExportService {
	private static final Logger logger = LoggerFactory.getLogger(CsvExportService.class);
	private static final CSVFormat SUMMARY_FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader("Symbol", "Earnings", "Yield%", "Yearly%")
			.build();

	public boolean exportCsv(List<? extends Investment> stocks, Path output) {
		return exportCsv(stocks, output, LocalDate.now());
	}

	public boolean exportCsv(List<? extends Investment> stocks, Path output, LocalDate asOf) {
		try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
			 CSVPrinter printer = new CSVPrinter(writer, SUMMARY_FORMAT)) {
			for (Investment stock : stocks) {
				printer.printRecord(stock.getSymbol(), twoDecimals(stock.earnings()),
						twoDecimals(stock.percentYield()), twoDecimals(stock.yearlyReturn(asOf)));
			}
			logger.info("Exported {} stocks to {}", stocks.size(), output);
			return true;
		} catch (IOException | RuntimeException exc) {
			logger.error("Failed to export CSV '{}': {}", output, exc.getMessage());
			return false;
		}
	}

	private static String twoDecimals(BigDecimal value) {
		return String.format(Locale.ROOT, "%.2f", value);
	}
}
