package works.docsink.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.bson.Document;
import org.bson.UuidRepresentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsink.mongo.MongoSinkSettings.ResetFailureMode;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * An open connection to MongoDB, bound to the sink's target collection.
 * <p>
 * Not safe for concurrent writers: the connection pool hands out connections,
 * but nothing here orders the writes. Give each concurrent writer its own session.
 */
public final class MongoSession implements AutoCloseable {
	static final int MAX_POOL_SIZE = 10;
	static final long MAX_IDLE_TIME_MS = 10_000;

	/**
	 * Server error for creating a collection that is already there.
	 */
	static final int NAMESPACE_EXISTS = 48;

	private final MongoSinkSettings settings;
	private final MongoClient client;
	private final MongoDatabase database;
	private final MongoCollection<Document> collection;
	private final boolean resetSucceeded;
	private final AtomicBoolean isClosed = new AtomicBoolean(false);

	private MongoSession(MongoSinkSettings settings, MongoClient client, boolean resetSucceeded) {
		this.settings = settings;
		this.client = client;
		this.database = client.getDatabase(settings.database());
		this.collection = database.getCollection(settings.collection());
		this.resetSucceeded = resetSucceeded;
	}

	public static MongoSession open(MongoSinkSettings settings) {
		return open(settings, MongoClientSettings.builder().build());
	}

	/**
	 * Connects, then drops and recreates the target collection.
	 * This is destructive initialization, not a way to reconnect:
	 * whatever the collection held is gone.
	 *
	 * @param baseClientSettings timeouts, credentials and so on.
	 * The address, the UUID representation and the connection pool limits are overridden.
	 * @throws SessionOpenException if the connection fails, or if the reset fails
	 * and {@link ResetFailureMode#FAIL} is in effect
	 */
	public static MongoSession open(MongoSinkSettings settings, MongoClientSettings baseClientSettings) {
		log(settings.debug(), "Connecting to {}", settings.address());
		MongoClient client = MongoClients.create(clientSettings(settings, baseClientSettings));
		try {
			client.getDatabase("admin").runCommand(new Document("ping", 1));
		} catch (MongoException e) {
			client.close();
			throw new SessionOpenException("unable to connect: " + e.getMessage(), e);
		}

		boolean resetSucceeded;
		try {
			resetSucceeded = resetCollection(
				client.getDatabase(settings.database()),
				settings.collection(),
				settings.resetFailureMode(),
				settings.debug());
		} catch (SessionOpenException e) {
			client.close();
			throw e;
		}
		return new MongoSession(settings, client, resetSucceeded);
	}

	static MongoClientSettings clientSettings(MongoSinkSettings settings, MongoClientSettings base) {
		return MongoClientSettings.builder(base)
			.uuidRepresentation(UuidRepresentation.STANDARD)
			.applyToClusterSettings(builder -> builder
				.hosts(List.of(new ServerAddress(settings.address()))))
			.applyToConnectionPoolSettings(builder -> builder
				.maxSize(MAX_POOL_SIZE)
				.maxConnectionIdleTime(MAX_IDLE_TIME_MS, MILLISECONDS))
			.build();
	}

	/**
	 * @return true if the collection was dropped and recreated;
	 * false if something went wrong and <code>mode</code> is {@link ResetFailureMode#BEST_EFFORT}.
	 * @throws SessionOpenException if something went wrong and <code>mode</code> is {@link ResetFailureMode#FAIL}
	 */
	static boolean resetCollection(MongoDatabase database, String collectionName, ResetFailureMode mode, boolean debug) {
		log(debug, "Dropping and creating collection '{}' on database '{}'", collectionName, database.getName());
		boolean result = true;
		try {
			// The driver already treats a missing collection as dropped
			database.getCollection(collectionName).drop();
		} catch (MongoException e) {
			result = resetFailed("drop", database.getName(), collectionName, mode, e);
		}
		try {
			database.createCollection(collectionName);
		} catch (MongoCommandException e) {
			if (e.getErrorCode() == NAMESPACE_EXISTS) {
				LOGGER.debug("Collection {} already exists", collectionName);
			} else {
				result = resetFailed("create", database.getName(), collectionName, mode, e);
			}
		} catch (MongoException e) {
			result = resetFailed("create", database.getName(), collectionName, mode, e);
		}
		return result;
	}

	private static boolean resetFailed(String step, String databaseName, String collectionName, ResetFailureMode mode, MongoException e) {
		if (mode == ResetFailureMode.FAIL) {
			throw new SessionOpenException("unable to reset collection " + databaseName + "." + collectionName + ": " + e.getMessage(), e);
		}
		LOGGER.warn("Unable to {} collection {}.{}; its contents are unknown", step, databaseName, collectionName, e);
		return false;
	}

	public MongoCollection<Document> collection() {
		return collection;
	}

	public MongoDatabase database() {
		return database;
	}

	public MongoSinkSettings settings() {
		return settings;
	}

	/**
	 * @return false if the collection may still contain documents from before this session was opened.
	 */
	public boolean resetSucceeded() {
		return resetSucceeded;
	}

	public boolean isClosed() {
		return isClosed.get();
	}

	@Override
	public void close() {
		if (isClosed.compareAndSet(false, true)) {
			log(settings.debug(), "Closing connection to {}", settings.address());
			client.close();
		}
	}

	private static void log(boolean debug, String format, Object... args) {
		if (debug) {
			LOGGER.info(format, args);
		} else {
			LOGGER.debug(format, args);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoSession.class);
}
