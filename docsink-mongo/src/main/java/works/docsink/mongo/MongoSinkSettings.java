package works.docsink.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoException;
import com.mongodb.ServerAddress;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import works.docsink.Namespace;

import static works.docsink.mongo.MongoSinkSettings.ResetFailureMode.BEST_EFFORT;

@Value
@Accessors(fluent = true)
public class MongoSinkSettings {
	/**
	 * <code>host:port</code>, or just <code>host</code> for the default port.
	 */
	String address;
	String database;
	String collection;

	/**
	 * Raises connection and reset logging from DEBUG to INFO.
	 */
	boolean debug;

	ResetFailureMode resetFailureMode;

	@Builder(toBuilder = true)
	private MongoSinkSettings(String address, String database, String collection, boolean debug, ResetFailureMode resetFailureMode) {
		if (address == null || address.isEmpty()) {
			throw new IllegalArgumentException("address must be given");
		}
		try {
			new ServerAddress(address);
		} catch (MongoException e) {
			throw new IllegalArgumentException("malformed address \"" + address + "\": " + e.getMessage(), e);
		}
		Namespace namespace = new Namespace(database, collection);
		this.address = address;
		this.database = namespace.database();
		this.collection = namespace.collection();
		this.debug = debug;
		this.resetFailureMode = resetFailureMode == null ? BEST_EFFORT : resetFailureMode;
	}

	/**
	 * @param uri a MongoDB connection string; only its first host is used
	 * @param namespace <code>database.collection</code>
	 */
	public static MongoSinkSettings fromUri(String uri, String namespace, boolean debug) {
		List<String> hosts = new ConnectionString(uri).getHosts();
		if (hosts.isEmpty()) {
			throw new IllegalArgumentException("No host in uri " + uri);
		}
		Namespace ns = Namespace.parse(namespace);
		return builder()
			.address(hosts.get(0))
			.database(ns.database())
			.collection(ns.collection())
			.debug(debug)
			.build();
	}

	public Namespace namespace() {
		return new Namespace(database, collection);
	}

	/**
	 * What {@link MongoSession#open} does if it can't empty the target collection.
	 */
	public enum ResetFailureMode {
		/**
		 * Log a warning and return the session anyway.
		 * The collection may still hold documents from before.
		 */
		BEST_EFFORT,

		/**
		 * Close the connection and throw {@link SessionOpenException}.
		 */
		FAIL,
	}
}
