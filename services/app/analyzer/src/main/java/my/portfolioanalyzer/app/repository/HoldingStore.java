package my.portfolioanalyzer.app.repository;

import my.portfolioanalyzer.app.domain.Bond;
import my.portfolioanalyzer.app.domain.Investment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Open handle on the SQLite holdings database. Owns a single connection that is released by {@link #close()}.
 */
public class HoldingStore implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(HoldingStore.class);

	private static final String CREATE_STOCKS = """
			create table if not exists stocks (
			    purchase_id text primary key,
			    symbol text,
			    quantity integer,
			    purchase_price real,
			    current_price real,
			    purchase_date text
			)
			""";
	private static final String CREATE_BONDS = """
			create table if not exists bonds (
			    purchase_id text primary key,
			    symbol text,
			    quantity integer,
			    purchase_price real,
			    current_price real,
			    coupon real,
			    yield_rate real,
			    purchase_date text
			)
			""";
	private static final String UPSERT_STOCK = """
			insert or replace into stocks
			    (purchase_id, symbol, quantity, purchase_price, current_price, purchase_date)
			values (?, ?, ?, ?, ?, ?)
			""";
	private static final String UPSERT_BOND = """
			insert or replace into bonds
			    (purchase_id, symbol, quantity, purchase_price, current_price, coupon, yield_rate, purchase_date)
			values (?, ?, ?, ?, ?, ?, ?, ?)
			""";

	private final Path path;
	private final SingleConnectionDataSource dataSource;
	private final JdbcTemplate jdbcTemplate;
	private final TransactionTemplate transactionTemplate;
	private boolean closed;

	private HoldingStore(Path path, SingleConnectionDataSource dataSource) {
		this.path = path;
		this.dataSource = dataSource;
		this.jdbcTemplate = new JdbcTemplate(dataSource);
		this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
	}

	public static HoldingStore open(Path path) {
		Path absolute = path.toAbsolutePath();
		Path parent = absolute.getParent();
		if (parent != null && !Files.isDirectory(parent)) {
			try {
				Files.createDirectories(parent);
			} catch (IOException exc) {
				throw new DataAccessResourceFailureException("Cannot create store directory " + parent, exc);
			}
		}
		SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + absolute, true);
		dataSource.setDriverClassName("org.sqlite.JDBC");
		HoldingStore store = new HoldingStore(absolute, dataSource);
		try {
			// reads the file header, so an unusable path fails here
			store.jdbcTemplate.queryForObject("pragma schema_version", Integer.class);
		} catch (RuntimeException exc) {
			dataSource.destroy();
			throw exc;
		}
		logger.debug("Opened holding store {}", absolute);
		return store;
	}

	public void inTransaction(Runnable work) {
		transactionTemplate.executeWithoutResult(status -> work.run());
	}

	public void createTables() {
		jdbcTemplate.execute(CREATE_STOCKS);
		jdbcTemplate.execute(CREATE_BONDS);
	}

	public void upsertStocks(Collection<? extends Investment> stocks) {
		if (stocks.isEmpty()) {
			return;
		}
		jdbcTemplate.batchUpdate(UPSERT_STOCK, stocks, stocks.size(), (ps, stock) -> bindBase(ps, stock));
	}

	public void upsertBonds(Collection<? extends Bond> bonds) {
		if (bonds.isEmpty()) {
			return;
		}
		jdbcTemplate.batchUpdate(UPSERT_BOND, bonds, bonds.size(), (ps, bond) -> {
			ps.setString(1, bond.getPurchaseId());
			ps.setString(2, bond.getSymbol());
			ps.setInt(3, bond.getQuantity());
			ps.setDouble(4, bond.getPurchasePrice().doubleValue());
			ps.setDouble(5, bond.getCurrentPrice().doubleValue());
			ps.setDouble(6, bond.getCoupon().doubleValue());
			ps.setDouble(7, bond.getYieldRate().doubleValue());
			ps.setString(8, bond.getPurchaseDateText());
		});
	}

	public List<Investment> findStocks() {
		return jdbcTemplate.query("""
				select purchase_id, symbol, quantity, purchase_price, current_price, purchase_date
				from stocks
				order by purchase_id
				""", STOCK_MAPPER);
	}

	public List<Bond> findBonds() {
		return jdbcTemplate.query("""
				select purchase_id, symbol, quantity, purchase_price, current_price, coupon, yield_rate, purchase_date
				from bonds
				order by purchase_id
				""", BOND_MAPPER);
	}

	public int countStocks() {
		return count("stocks");
	}

	public int countBonds() {
		return count("bonds");
	}

	public Path getPath() {
		return path;
	}

	public boolean isClosed() {
		return closed;
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		dataSource.destroy();
		logger.debug("Closed holding store {}", path);
	}

	private int count(String table) {
		Integer count = jdbcTemplate.queryForObject("select count(*) from " + table, Integer.class);
		return count == null ? 0 : count;
	}

	private static void bindBase(PreparedStatement ps, Investment stock) throws SQLException {
		ps.setString(1, stock.getPurchaseId());
		ps.setString(2, stock.getSymbol());
		ps.setInt(3, stock.getQuantity());
		ps.setDouble(4, stock.getPurchasePrice().doubleValue());
		ps.setDouble(5, stock.getCurrentPrice().doubleValue());
		ps.setString(6, stock.getPurchaseDateText());
	}

	private static final RowMapper<Investment> STOCK_MAPPER = (rs, rowNum) -> new Investment(
			rs.getString("purchase_id"),
			rs.getString("symbol"),
			rs.getInt("quantity"),
			decimal(rs, "purchase_price"),
			decimal(rs, "current_price"),
			date(rs)
	);

	private static final RowMapper<Bond> BOND_MAPPER = (rs, rowNum) -> new Bond(
			rs.getString("purchase_id"),
			rs.getString("symbol"),
			rs.getInt("quantity"),
			decimal(rs, "purchase_price"),
			decimal(rs, "current_price"),
			decimal(rs, "coupon"),
			decimal(rs, "yield_rate"),
			date(rs)
	);

	private static BigDecimal decimal(ResultSet rs, String column) throws SQLException {
		return BigDecimal.valueOf(rs.getDouble(column));
	}

	private static LocalDate date(ResultSet rs) throws SQLException {
		return Investment.parsePurchaseDate(rs.getString("purchase_date"));
	}
}
