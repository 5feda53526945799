package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Base class for fluent search builders over paginated endpoints.
 *
 * <p>
 * A builder accumulates query parameters through chained setters and then either fetches a
 * single page with {@link #execute()} or walks every page lazily with {@link #all()}. The
 * actual call is made by the {@link PageExecutor} the owning resource client passes in, so
 * the same pagination logic serves every endpoint.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * // First page only
 * IssuesClient.IssueSearchResponse page = client.issues().search()
 *     .withProjects(List.of("my-project"))
 *     .pageSize(100)
 *     .execute();
 *
 * // Every issue, fetched page by page as the loop advances
 * for (Issue issue : client.issues().search().withProjects(List.of("my-project")).all()) {
 *     ...
 * }
 * }
 * </pre>
 *
 * <p>
 * Subclasses add domain setters on top of {@link #setParam(String, Object)} and may reject
 * invalid combinations there by throwing {@link ValidationException}, before any request is
 * made.
 *
 * @param <B> the concrete builder type, returned by every setter
 * @param <R> the page response type
 * @param <T> the item type
 */
public abstract class PaginatedBuilder<B extends PaginatedBuilder<B, R, T>, R extends Paged<T>, T> {

	private static final Logger logger = LoggerFactory.getLogger(PaginatedBuilder.class);

	private static final Pattern NUMERIC = Pattern.compile("\\d{1,9}");

	private final PageExecutor<R> executor;

	private final PaginationStyle paginationStyle;

	private final QueryParameters params = new QueryParameters();

	protected PaginatedBuilder(PageExecutor<R> executor, PaginationStyle paginationStyle) {
		this.executor = Objects.requireNonNull(executor, "executor");
		this.paginationStyle = Objects.requireNonNull(paginationStyle, "paginationStyle");
	}

	@SuppressWarnings("unchecked")
	protected final B self() {
		return (B) this;
	}

	/**
	 * Store a parameter. A {@code null} value is ignored and a repeated name replaces the
	 * earlier value.
	 * @param name parameter name as the endpoint expects it
	 * @param value parameter value
	 * @return this builder
	 */
	protected B setParam(String name, @Nullable Object value) {
		params.set(name, value);
		return self();
	}

	/**
	 * Whether a parameter has been set. Used by subclasses to validate combinations.
	 * @param name parameter name
	 * @return true if set
	 */
	protected boolean hasParam(String name) {
		return params.contains(name);
	}

	@Nullable
	protected Object getParam(String name) {
		return params.get(name);
	}

	/**
	 * Snapshot of the parameters collected so far.
	 * @return copy of the parameters
	 */
	public QueryParameters getParams() {
		return params.copy();
	}

	public PaginationStyle getPaginationStyle() {
		return paginationStyle;
	}

	/**
	 * Set the 1-based page to fetch. Not validated; the server decides what is acceptable.
	 * @param page page number
	 * @return this builder
	 */
	public B page(int page) {
		return setParam(paginationStyle.pageParam(), page);
	}

	/**
	 * Set the page size. Not validated; the server decides what is acceptable.
	 * @param pageSize number of items per page
	 * @return this builder
	 */
	public B pageSize(int pageSize) {
		return setParam(paginationStyle.pageSizeParam(), pageSize);
	}

	/**
	 * Fetch a single page with the current parameters.
	 * @return the response as returned by the executor
	 * @throws SonarQubeException if the call fails
	 */
	public R execute() {
		return fetch(params.copy());
	}

	/**
	 * Every item of the query, fetched lazily page by page.
	 *
	 * <p>
	 * Each call to {@link Iterable#iterator()} starts an independent traversal that takes a
	 * snapshot of the parameters at that moment and begins at the page already set on this
	 * builder (a number, or numeric text), or page 1. Pages are fetched one after another,
	 * only when the previous page has been consumed. The traversal ends on an empty page,
	 * once {@code paging.total} items have been covered, or when a response carries no
	 * paging at all.
	 * @return lazily evaluated items in server order
	 */
	public Iterable<T> all() {
		return () -> new PageIterator(params.copy());
	}

	/**
	 * Sequential stream over {@link #all()}. Short-circuiting operations such as
	 * {@code limit} stop further page fetches.
	 * @return lazily evaluated items in server order
	 */
	public Stream<T> stream() {
		return StreamSupport.stream(all().spliterator(), false);
	}

	private R fetch(QueryParameters snapshot) {
		logger.debug("{} fetching {}", getClass().getSimpleName(), snapshot.asMap());
		return executor.fetch(snapshot);
	}

	private int startPage(QueryParameters snapshot) {
		Object page = snapshot.get(paginationStyle.pageParam());
		if (page instanceof Number) {
			return Math.max(1, ((Number) page).intValue());
		}
		if (page instanceof String && NUMERIC.matcher(((String) page).trim()).matches()) {
			return Math.max(1, Integer.parseInt(((String) page).trim()));
		}
		return 1;
	}

	private final class PageIterator implements Iterator<T> {

		private final QueryParameters snapshot;

		private int nextPage;

		private long covered;

		private Iterator<T> buffer = Collections.emptyIterator();

		private boolean exhausted;

		PageIterator(QueryParameters snapshot) {
			this.snapshot = snapshot;
			this.nextPage = startPage(snapshot);
		}

		@Override
		public boolean hasNext() {
			while (!buffer.hasNext()) {
				if (exhausted) {
					return false;
				}
				fetchNextPage();
			}
			return true;
		}

		@Override
		public T next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return buffer.next();
		}

		private void fetchNextPage() {
			int page = nextPage;
			R response = fetch(snapshot.copy().set(paginationStyle.pageParam(), page));
			nextPage++;

			List<T> items = response.items();
			if (items.isEmpty()) {
				// Guards against a reported total the server never delivers
				exhausted = true;
				return;
			}
			covered += items.size();
			buffer = items.iterator();

			Paging paging = response.paging();
			if (paging == null || isLastPage(paging, page)) {
				exhausted = true;
			}
		}

		private boolean isLastPage(Paging paging, int page) {
			return covered >= paging.total() || (long) page * paging.pageSize() >= paging.total();
		}

	}

}
