package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A single page of a paginated search.
 *
 * <p>
 * Response records keep the field name their endpoint uses ({@code issues},
 * {@code components}, {@code hotspots}, ...) and expose it through {@link #items()}.
 *
 * @param <T> the item type
 */
public interface Paged<T> {

	/**
	 * Items of this page in server order.
	 * @return the items, never null
	 */
	List<T> items();

	/**
	 * Paging information of this page.
	 * @return the paging, or null if the endpoint returned none
	 */
	@Nullable
	Paging paging();

}
