package my.portfolioanalyzer.app.util;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void stripBomRemovesLeadingMarker() {
		String value = "\uFEFFa,b,c";
		assertThat(CsvParsing.stripBom(value)).isEqualTo("a,b,c");
	}

	@Test
	void stripBomHandlesNullAndEmpty() {
		assertThat(CsvParsing.stripBom(null)).isNull();
		assertThat(CsvParsing.stripBom("")).isEqualTo("");
	}

	@Test
	void holdingLinesKeepEmptyLinesAndTrimValues() throws IOException {
		try (CSVParser parser = CSVParser.parse("MSFT , 10\n\n GOOGL,5\n", CsvParsing.HOLDING_LINES)) {
			List<CSVRecord> records = parser.getRecords();

			assertThat(records).hasSize(3);
			assertThat(records.get(0).toList()).containsExactly("MSFT", "10");
			assertThat(records.get(1).size()).isEqualTo(1);
			assertThat(records.get(2).getRecordNumber()).isEqualTo(3);
			assertThat(records.get(2).get(0)).isEqualTo("GOOGL");
		}
	}
}
