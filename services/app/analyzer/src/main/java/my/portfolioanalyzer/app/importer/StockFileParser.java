package my.portfolioanalyzer.app.importer;

import my.portfolioanalyzer.app.domain.Investment;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

/**
 * {@code symbol,quantity,purchase_price,current_price,purchase_date}
 */
@Component
public class StockFileParser extends DelimitedHoldingParser<Investment> {
	public StockFileParser() {
		super("stock", "S", 5, ParsePolicy.FAIL_FAST);
	}

	@Override
	protected Investment toHolding(String purchaseId, CSVRecord record) {
		return Investment.fromText(purchaseId, record.get(0), record.get(1), record.get(2), record.get(3),
				record.get(4));
	}
}
