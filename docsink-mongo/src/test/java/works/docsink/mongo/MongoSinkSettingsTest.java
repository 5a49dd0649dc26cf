package works.docsink.mongo;

import org.junit.jupiter.api.Test;
import works.docsink.Namespace;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.docsink.mongo.MongoSinkSettings.ResetFailureMode.BEST_EFFORT;
import static works.docsink.mongo.MongoSinkSettings.ResetFailureMode.FAIL;

class MongoSinkSettingsTest {

	@Test
	void fromUri_withPort() {
		MongoSinkSettings settings = MongoSinkSettings.fromUri("mongodb://db.example.com:27018", "shop.orders", true);
		assertEquals("db.example.com:27018", settings.address());
		assertEquals("shop", settings.database());
		assertEquals("orders", settings.collection());
		assertTrue(settings.debug());
		assertEquals(BEST_EFFORT, settings.resetFailureMode());
	}

	@Test
	void fromUri_withoutPort() {
		MongoSinkSettings settings = MongoSinkSettings.fromUri("mongodb://localhost", "shop.orders", false);
		assertEquals("localhost", settings.address());
		assertFalse(settings.debug());
	}

	@Test
	void fromUri_firstHostOnly() {
		MongoSinkSettings settings = MongoSinkSettings.fromUri("mongodb://a:1,b:2/?replicaSet=rs0", "shop.orders", false);
		assertEquals("a:1", settings.address());
	}

	@Test
	void fromUri_collectionMayContainDots() {
		MongoSinkSettings settings = MongoSinkSettings.fromUri("mongodb://localhost", "shop.orders.2024", false);
		assertEquals(new Namespace("shop", "orders.2024"), settings.namespace());
	}

	@Test
	void fromUri_badNamespace_throws() {
		assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.fromUri("mongodb://localhost", "orders", false));
		assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.fromUri("mongodb://localhost", ".orders", false));
		assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.fromUri("mongodb://localhost", "shop.", false));
	}

	@Test
	void fromUri_badUri_throws() {
		assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.fromUri("localhost:27017", "shop.orders", false));
	}

	@Test
	void builder_requiresAddress() {
		assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.builder()
			.database("shop")
			.collection("orders")
			.build());
	}

	@Test
	void builder_rejectsMalformedAddress() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.builder()
			.address("localhost:notaport")
			.database("shop")
			.collection("orders")
			.build());
		assertThat(e.getMessage(), startsWith("malformed address \"localhost:notaport\""));
	}

	@Test
	void builder_acceptsHostWithOrWithoutPort() {
		assertEquals("localhost", settings("localhost").address());
		assertEquals("db.example.com:27018", settings("db.example.com:27018").address());
		assertEquals("[::1]:27017", settings("[::1]:27017").address());
	}

	@Test
	void builder_requiresDatabaseAndCollection() {
		assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.builder()
			.address("localhost")
			.collection("orders")
			.build());
		assertThrows(IllegalArgumentException.class, () -> MongoSinkSettings.builder()
			.address("localhost")
			.database("shop")
			.collection("")
			.build());
	}

	private static MongoSinkSettings settings(String address) {
		return MongoSinkSettings.builder()
			.address(address)
			.database("shop")
			.collection("orders")
			.build();
	}

	@Test
	void toBuilder_overridesResetMode() {
		MongoSinkSettings original = MongoSinkSettings.fromUri("mongodb://localhost", "shop.orders", false);
		MongoSinkSettings strict = original.toBuilder().resetFailureMode(FAIL).build();
		assertEquals(FAIL, strict.resetFailureMode());
		assertEquals(original.namespace(), strict.namespace());
		assertEquals(BEST_EFFORT, original.resetFailureMode());
	}
}
