package my.portfolioanalyzer.app.importer;

import my.portfolioanalyzer.app.domain.Bond;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

/**
 * {@code symbol,quantity,purchase_price,current_price,coupon,yield_rate,purchase_date}
 */
@Component
public class BondFileParser extends DelimitedHoldingParser<Bond> {
	public BondFileParser() {
		super("bond", "B", 7, ParsePolicy.SKIP_FIELD_COUNT_MISMATCH);
	}

	@Override
	protected Bond toHolding(String purchaseId, CSVRecord record) {
		return Bond.fromText(purchaseId, record.get(0), record.get(1), record.get(2), record.get(3),
				record.get(4), record.get(5), record.get(6));
	}
}
