package my.portfolioanalyzer.app.importer;

import my.portfolioanalyzer.app.domain.Investment;

import java.nio.file.Path;

public interface HoldingParser<T extends Investment> {
	ParseResult<T> read(Path path);
}
