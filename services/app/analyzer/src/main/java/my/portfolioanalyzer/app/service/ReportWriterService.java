package my.portfolioanalyzer.app.service;

import my.portfolioanalyzer.app.domain.Bond;
import my.portfolioanalyzer.app.domain.Investment;
import my.portfolioanalyzer.app.domain.Investor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Service
public class ReportWriterService {
	private static final Logger logger = LoggerFactory.getLogger(ReportWriterService.class);

	public boolean writeReport(Investor investor, List<? extends Investment> stocks, List<? extends Bond> bonds,
							   Path output) {
		return writeReport(investor, stocks, bonds, output, LocalDate.now());
	}

	public boolean writeReport(Investor investor, List<? extends Investment> stocks, List<? extends Bond> bonds,
							   Path output, LocalDate asOf) {
		try {
			String report = render(investor, stocks, bonds, asOf);
			Files.writeString(output, report, StandardCharsets.UTF_8);
			logger.info("Wrote investment report {}", output);
			return true;
		} catch (IOException | RuntimeException exc) {
			logger.error("Failed to write report '{}': {}", output, exc.getMessage());
			return false;
		}
	}

	String render(Investor investor, List<? extends Investment> stocks, List<? extends Bond> bonds, LocalDate asOf) {
		StringBuilder out = new StringBuilder();
		out.append("Investor: ").append(investor.name()).append('\n');
		out.append("Address: ").append(investor.address()).append('\n');
		out.append("Phone: ").append(investor.phone()).append("\n\n");

		out.append("STOCKS:\n");
		out.append(format("%-6s%-10s%-6s%-10s%-10s%-10s\n", "ID", "Symbol", "Qty", "Earn", "Yield%", "Yearly%"));
		for (Investment stock : stocks) {
			out.append(format("%-6s%-10s%-6d%-10.2f%-10.2f%-10.2f\n",
					stock.getPurchaseId(), stock.getSymbol(), stock.getQuantity(),
					stock.earnings(), stock.percentYield(), stock.yearlyReturn(asOf)));
		}

		out.append("\nBONDS:\n");
		out.append(format("%-6s%-10s%-6s%-10s%-12s\n", "ID", "Symbol", "Qty", "Earn", "Date"));
		for (Bond bond : bonds) {
			out.append(format("%-6s%-10s%-6d%-10.2f%-12s\n",
					bond.getPurchaseId(), bond.getSymbol(), bond.getQuantity(),
					bond.earnings(), bond.getPurchaseDateText()));
		}
		return out.toString();
	}

	private static String format(String pattern, Object... args) {
		return String.format(Locale.ROOT, pattern, args);
	}
}
