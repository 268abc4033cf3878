package my.portfolioanalyzer.app.service;

import my.portfolioanalyzer.app.domain.Investment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Text menu over the stock holdings. Reads commands until "exit" or end of input.
 */
@Service
public class PortfolioFilterConsole {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioFilterConsole.class);
	private static final String MENU = "Filter options: [1] positive, [2] negative, [3] sort, [4] lookup, [5] exit";

	public void run(List<? extends Investment> stocks, Reader input, PrintStream out) {
		run(stocks, input, out, LocalDate.now());
	}

	public void run(List<? extends Investment> stocks, Reader input, PrintStream out, LocalDate asOf) {
		BufferedReader reader = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);
		try {
			while (true) {
				out.println();
				out.println(MENU);
				out.print("Choice: ");
				out.flush();
				String line = reader.readLine();
				if (line == null) {
					return;
				}
				String command = normalize(line);
				if (command.equals("5") || command.equals("exit") || command.equals("quit")) {
					return;
				}
				try {
					if (!dispatch(command, stocks, reader, out, asOf)) {
						return;
					}
				} catch (RuntimeException exc) {
					logger.warn("Filter command '{}' failed: {}", command, exc.toString());
					out.println("Error: " + exc.getMessage());
				}
			}
		} catch (IOException exc) {
			logger.warn("Interactive filter stopped: {}", exc.getMessage());
		}
	}

	// false when input ended while the command was still reading
	private boolean dispatch(String command, List<? extends Investment> stocks, BufferedReader reader,
							 PrintStream out, LocalDate asOf) throws IOException {
		switch (command) {
			case "1", "positive" -> listEarnings(stocks, out, true);
			case "2", "negative" -> listEarnings(stocks, out, false);
			case "3", "sort" -> listByYearlyReturn(stocks, out, asOf);
			case "4", "lookup" -> {
				out.print("Enter symbol: ");
				out.flush();
				String symbol = reader.readLine();
				if (symbol == null) {
					return false;
				}
				lookup(stocks, symbol, out, asOf);
			}
			default -> out.println("Invalid.");
		}
		return true;
	}

	static String normalize(String line) {
		String trimmed = line.trim().toLowerCase(Locale.ROOT);
		if (trimmed.isEmpty()) {
			return "";
		}
		return trimmed.split("\\s+")[0];
	}

	private void listEarnings(List<? extends Investment> stocks, PrintStream out, boolean positive) {
		for (Investment stock : stocks) {
			int sign = stock.earnings().signum();
			if (positive ? sign > 0 : sign < 0) {
				out.println(String.format(Locale.US, "%s: $%,.2f", stock.getSymbol(), stock.earnings()));
			}
		}
	}

	private void listByYearlyReturn(List<? extends Investment> stocks, PrintStream out, LocalDate asOf) {
		stocks.stream()
				.sorted(Comparator.comparing((Investment stock) -> stock.yearlyReturn(asOf)).reversed())
				.forEach(stock -> out.println(String.format(Locale.US, "%s: %.2f%%",
						stock.getSymbol(), stock.yearlyReturn(asOf))));
	}

	private void lookup(List<? extends Investment> stocks, String rawSymbol, PrintStream out, LocalDate asOf) {
		String symbol = rawSymbol.trim().toUpperCase(Locale.ROOT);
		Optional<? extends Investment> found = stocks.stream()
				.filter(stock -> stock.getSymbol().equals(symbol))
				.findFirst();
		if (found.isEmpty()) {
			out.println("Not found.");
			return;
		}
		Investment stock = found.get();
		out.println(String.format(Locale.US, "%s: Earn=%.2f, Yearly%%=%.2f",
				stock.getSymbol(), stock.earnings(), stock.yearlyReturn(asOf)));
	}
}
