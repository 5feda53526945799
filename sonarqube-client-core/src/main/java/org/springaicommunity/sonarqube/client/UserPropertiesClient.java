package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for {@code api/user_properties}, which no longer exists on any supported server.
 *
 * @deprecated removed in SonarQube 6.3. Use {@link FavoritesClient} for favorite
 * components and {@link NotificationsClient} for notification subscriptions.
 */
@Deprecated
public class UserPropertiesClient extends ResourceClient {

	static final String REMOVED_IN = "6.3";

	public UserPropertiesClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	/**
	 * Always fails without contacting the server.
	 * @return never returns normally
	 * @throws RemovedApiException always, listing the replacement operations
	 */
	@Deprecated
	public Map<String, String> index() {
		Map<String, String> migration = new LinkedHashMap<>();
		migration.put("favorites", "favorites().search(), favorites().add(key) and favorites().remove(key)");
		migration.put("notifications",
				"notifications().list(), notifications().add(...) and notifications().remove(...)");
		throw ErrorClassifier.removedApi("api/user_properties", REMOVED_IN, migration);
	}

}
