package org.springaicommunity.sonarqube.client;

/**
 * Search builder for {@code api/favorites/search}. The endpoint takes no filter beyond
 * paging.
 */
public final class FavoriteSearchBuilder
		extends PaginatedBuilder<FavoriteSearchBuilder, FavoritesClient.FavoriteSearchResponse, Favorite> {

	FavoriteSearchBuilder(PageExecutor<FavoritesClient.FavoriteSearchResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

}
