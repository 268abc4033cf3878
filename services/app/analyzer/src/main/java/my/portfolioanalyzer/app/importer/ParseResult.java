package my.portfolioanalyzer.app.importer;

import my.portfolioanalyzer.app.domain.Investment;

import java.util.List;

public record ParseResult<T extends Investment>(
		List<T> holdings,
		List<LineFailure> failures,
		int skippedLines
) {
	public ParseResult {
		holdings = holdings == null ? List.of() : List.copyOf(holdings);
		failures = failures == null ? List.of() : List.copyOf(failures);
	}

	public boolean complete() {
		return failures.isEmpty();
	}
}
