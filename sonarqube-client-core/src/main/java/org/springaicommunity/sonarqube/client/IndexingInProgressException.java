package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * HTTP 503 returned while the server is (re)building its issue index. The same request
 * usually succeeds once indexing has finished.
 */
public class IndexingInProgressException extends ServerException {

	public IndexingInProgressException(String message, @Nullable String requestId, @Nullable String responseBody,
			Map<String, List<String>> headers) {
		super(message, 503, requestId, responseBody, headers);
	}

}
