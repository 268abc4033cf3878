package my.portfolioanalyzer.app.importer;

/**
 * Line number 0 means the file itself could not be read.
 */
public record LineFailure(
		int lineNumber,
		String line,
		String message
) {
}
