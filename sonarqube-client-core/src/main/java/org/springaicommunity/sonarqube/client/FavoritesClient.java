package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/favorites}. Operates on the favorites of the authenticated user.
 */
public class FavoritesClient extends ResourceClient {

	public FavoritesClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public void add(String componentKey) {
		post("/api/favorites/add", component(componentKey));
	}

	public void remove(String componentKey) {
		post("/api/favorites/remove", component(componentKey));
	}

	public FavoriteSearchBuilder search() {
		return new FavoriteSearchBuilder(this::search);
	}

	public FavoriteSearchResponse search(QueryParameters params) {
		return getJson("/api/favorites/search", params, FavoriteSearchResponse.class);
	}

	private static QueryParameters component(String componentKey) {
		return QueryParameters.create().set("component", Validation.requireNonBlank(componentKey, "component"));
	}

	public record FavoriteSearchResponse(List<Favorite> favorites, @Nullable Paging paging)
			implements Paged<Favorite> {

		public FavoriteSearchResponse {
			favorites = favorites != null ? List.copyOf(favorites) : List.of();
		}

		@Override
		public List<Favorite> items() {
			return favorites;
		}

	}

}
