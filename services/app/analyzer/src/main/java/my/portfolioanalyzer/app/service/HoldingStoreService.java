package my.portfolioanalyzer.app.service;

import my.portfolioanalyzer.app.domain.Bond;
import my.portfolioanalyzer.app.domain.Investment;
import my.portfolioanalyzer.app.repository.HoldingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

@Service
public class HoldingStoreService {
	private static final Logger logger = LoggerFactory.getLogger(HoldingStoreService.class);

	/**
	 * Opens the store at {@code path}, creates the tables if needed and upserts every holding by purchase id
	 * in one committed transaction. The caller owns the returned handle and must close it.
	 */
	public HoldingStore setupStore(Path path, List<? extends Investment> stocks, List<? extends Bond> bonds) {
		HoldingStore store = HoldingStore.open(path);
		try {
			store.inTransaction(() -> {
				store.createTables();
				store.upsertStocks(stocks);
				store.upsertBonds(bonds);
			});
		} catch (RuntimeException exc) {
			store.close();
			throw exc;
		}
		logger.info("Upserted {} stocks and {} bonds into {}", stocks.size(), bonds.size(), store.getPath());
		return store;
	}
}
