package my.portfolioanalyzer.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.portfolioanalyzer.app.model.PriceQuote;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
public class PriceHistoryLoader {
	private final ObjectMapper objectMapper;

	public PriceHistoryLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Reads a JSON array of {@code {Symbol, Date, Close}} objects. Entries are mapped one by one so that a
	 * malformed entry only loses its own values.
	 */
	public List<PriceQuote> load(Path path) throws IOException {
		JsonNode root;
		try (InputStream in = Files.newInputStream(path)) {
			root = objectMapper.readTree(in);
		}
		if (root == null || root.isMissingNode() || root.isNull()) {
			return List.of();
		}
		if (!root.isArray()) {
			throw new IOException("Expected a JSON array of price records in " + path);
		}
		List<PriceQuote> quotes = new ArrayList<>(root.size());
		for (JsonNode entry : root) {
			if (entry.isObject()) {
				quotes.add(new PriceQuote(scalar(entry, "Symbol"), scalar(entry, "Date"), scalar(entry, "Close")));
			}
		}
		return quotes;
	}

	private static String scalar(JsonNode entry, String field) {
		JsonNode value = entry.get(field);
		if (value == null || value.isNull() || !value.isValueNode()) {
			return null;
		}
		return value.asText();
	}
}
