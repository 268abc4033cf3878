package my.portfolioanalyzer.app.importer;

import my.portfolioanalyzer.app.domain.Investment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;

class StockFileParserTest {
	private final StockFileParser parser = new StockFileParser();

	@TempDir
	Path tempDir;

	@Test
	void parsesSampleResourceFile() throws URISyntaxException {
		Path path = Path.of(Objects.requireNonNull(getClass().getResource("/imports/stocks.txt")).toURI());

		ParseResult<Investment> result = parser.read(path);

		assertThat(result.complete()).isTrue();
		assertThat(result.holdings())
				.extracting(Investment::getPurchaseId)
				.containsExactly("S1", "S2", "S3");
		Investment first = result.holdings().get(0);
		assertThat(first.getSymbol()).isEqualTo("GOOGL");
		assertThat(first.getQuantity()).isEqualTo(125);
		assertThat(first.getPurchasePrice()).isEqualByComparingTo("772.88");
	}

	@Test
	void stopsAtFirstLineWithWrongFieldCount() throws IOException {
		Path path = write("AAA,10,1.00,2.00,1/2/2020\n"
				+ "BBB,10,1.00\n"
				+ "CCC,10,1.00,2.00,1/2/2020\n");

		ParseResult<Investment> result = parser.read(path);

		assertThat(result.holdings()).extracting(Investment::getSymbol).containsExactly("AAA");
		assertThat(result.complete()).isFalse();
		assertThat(result.failures()).singleElement().satisfies(failure -> {
			assertThat(failure.lineNumber()).isEqualTo(2);
			assertThat(failure.line()).isEqualTo("BBB,10,1.00");
			assertThat(failure.message()).contains("Expected 5 fields");
		});
	}

	@Test
	void quoteCharactersAreOrdinaryText() throws IOException {
		Path path = write("AAA,10,1.00,2.00,1/2/2020\n"
				+ "\"BBB,10,1.00,2.00,1/2/2020\n"
				+ "CCC,10,1.00,2.00,1/2/2020\n");

		ParseResult<Investment> result = parser.read(path);

		assertThat(result.complete()).isTrue();
		assertThat(result.holdings()).extracting(Investment::getSymbol).containsExactly("AAA", "\"BBB", "CCC");
	}

	@Test
	void stopsAtFirstUnparseableNumber() throws IOException {
		Path path = write("AAA,10,1.00,2.00,1/2/2020\n"
				+ "BBB,10.5,1.00,2.00,1/2/2020\n");

		ParseResult<Investment> result = parser.read(path);

		assertThat(result.holdings()).hasSize(1);
		assertThat(result.failures()).singleElement()
				.satisfies(failure -> assertThat(failure.lineNumber()).isEqualTo(2));
	}

	@Test
	void blankLineEndsTheReadButKeepsLineNumbers() throws IOException {
		Path path = write("AAA,10,1.00,2.00,1/2/2020\n\nBBB,10,1.00,2.00,1/2/2020\n");

		ParseResult<Investment> result = parser.read(path);

		assertThat(result.holdings()).extracting(Investment::getPurchaseId).containsExactly("S1");
		assertThat(result.failures()).singleElement()
				.satisfies(failure -> assertThat(failure.lineNumber()).isEqualTo(2));
	}

	@Test
	void missingFileIsReportedAsFailure() {
		ParseResult<Investment> result = parser.read(tempDir.resolve("missing.txt"));

		assertThat(result.holdings()).isEmpty();
		assertThat(result.failures()).singleElement().satisfies(failure -> {
			assertThat(failure.lineNumber()).isZero();
			assertThat(failure.message()).contains("NoSuchFileException");
		});
	}

	@Test
	void trimsFieldsAndStripsBom() throws IOException {
		Path path = write("\uFEFF AAA , 10 , 1.00 , 2.00 , 01/02/2020 \r\n");

		ParseResult<Investment> result = parser.read(path);

		assertThat(result.complete()).isTrue();
		assertThat(result.holdings()).singleElement().satisfies(holding -> {
			assertThat(holding.getSymbol()).isEqualTo("AAA");
			assertThat(holding.getQuantity()).isEqualTo(10);
		});
	}

	@Test
	void usesFailFastPolicy() {
		assertThat(parser.getPolicy()).isEqualTo(ParsePolicy.FAIL_FAST);
	}

	private Path write(String content) throws IOException {
		Path path = tempDir.resolve("stocks.txt");
		Files.writeString(path, content, StandardCharsets.UTF_8);
		return path;
	}
}
