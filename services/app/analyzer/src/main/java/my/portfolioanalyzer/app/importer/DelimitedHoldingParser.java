package my.portfolioanalyzer.app.importer;

import my.portfolioanalyzer.app.domain.Investment;
import my.portfolioanalyzer.app.util.CsvParsing;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one holding per line. The purchase id is the id prefix followed by the 1-based line number.
 * Failures never escape {@link #read(Path)}; they end the read and are returned with the holdings
 * parsed so far.
 */
public abstract class DelimitedHoldingParser<T extends Investment> implements HoldingParser<T> {
	private static final Logger logger = LoggerFactory.getLogger(DelimitedHoldingParser.class);

	private final String kind;
	private final String idPrefix;
	private final int expectedFields;
	private final ParsePolicy policy;

	protected DelimitedHoldingParser(String kind, String idPrefix, int expectedFields, ParsePolicy policy) {
		this.kind = kind;
		this.idPrefix = idPrefix;
		this.expectedFields = expectedFields;
		this.policy = policy;
	}

	@Override
	public ParseResult<T> read(Path path) {
		String content;
		try {
			content = CsvParsing.stripBom(Files.readString(path, StandardCharsets.UTF_8));
		} catch (IOException | RuntimeException exc) {
			return fail(path, List.of(), new LineFailure(0, "", describe(exc)), 0);
		}
		return parse(path, content);
	}

	ParseResult<T> parse(Path path, String content) {
		List<T> holdings = new ArrayList<>();
		int skipped = 0;
		int lineNumber = 0;
		String line = null;
		try (CSVParser parser = CSVParser.parse(new StringReader(content), CsvParsing.HOLDING_LINES)) {
			for (CSVRecord record : parser) {
				lineNumber = (int) record.getRecordNumber();
				line = String.join(",", record.toList());
				if (record.size() != expectedFields) {
					if (policy == ParsePolicy.SKIP_FIELD_COUNT_MISMATCH) {
						skipped++;
						line = null;
						continue;
					}
					String message = "Expected " + expectedFields + " fields but found " + record.size();
					return fail(path, holdings, new LineFailure(lineNumber, line, message), skipped);
				}
				holdings.add(toHolding(idPrefix + lineNumber, record));
				line = null;
			}
		} catch (IOException | RuntimeException exc) {
			// a null line means the reader failed before handing out the next record
			int failedAt = line == null ? lineNumber + 1 : lineNumber;
			String raw = line == null ? "" : line;
			return fail(path, holdings, new LineFailure(failedAt, raw, describe(exc)), skipped);
		}
		logger.debug("Read {} {} holdings from {} ({} lines skipped)", holdings.size(), kind, path, skipped);
		return new ParseResult<>(holdings, List.of(), skipped);
	}

	protected abstract T toHolding(String purchaseId, CSVRecord record);

	public ParsePolicy getPolicy() {
		return policy;
	}

	private ParseResult<T> fail(Path path, List<T> holdings, LineFailure failure, int skipped) {
		logger.warn("Error reading {} file '{}' at line {}: {} ({} holdings read before the failure)",
				kind, path, failure.lineNumber(), failure.message(), holdings.size());
		return new ParseResult<>(holdings, List.of(failure), skipped);
	}

	private static String describe(Exception exc) {
		String message = exc.getMessage();
		return exc.getClass().getSimpleName() + (message == null ? "" : ": " + message);
	}
}
