package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class of the per-area clients. Holds the shared transport and mapper and converts
 * response bodies into typed records at the client boundary.
 *
 * <p>
 * A body that cannot be mapped is reported as an {@link ApiException} with status 200,
 * carrying the raw body, so callers only ever deal with {@link SonarQubeException}.
 */
public abstract class ResourceClient {

	private static final Logger logger = LoggerFactory.getLogger(ResourceClient.class);

	private final SonarQubeTransport transport;

	private final ObjectMapper objectMapper;

	protected ResourceClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		this.transport = Objects.requireNonNull(transport, "transport");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
	}

	protected SonarQubeTransport transport() {
		return transport;
	}

	protected ObjectMapper objectMapper() {
		return objectMapper;
	}

	protected <T> T getJson(String path, QueryParameters query, Class<T> type) {
		return read(path, transport.get(path, query), type);
	}

	protected <T> T getJson(String path, QueryParameters query, TypeReference<T> type) {
		String body = transport.get(path, query);
		try {
			return objectMapper.readValue(body, type);
		}
		catch (JsonProcessingException e) {
			throw unreadable(path, body, e);
		}
	}

	protected JsonNode getTree(String path, QueryParameters query) {
		String body = transport.get(path, query);
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw unreadable(path, body, e);
		}
	}

	protected String getText(String path, QueryParameters query) {
		return transport.get(path, query);
	}

	protected byte[] getBytes(String path, QueryParameters query) {
		return transport.getBytes(path, query);
	}

	/**
	 * POST to an endpoint that answers with no content, or with content the caller does
	 * not need.
	 */
	protected void post(String path, QueryParameters form) {
		transport.post(path, form);
	}

	protected <T> T postJson(String path, QueryParameters form, Class<T> type) {
		return read(path, transport.post(path, form), type);
	}

	private <T> T read(String path, String body, Class<T> type) {
		try {
			return objectMapper.readValue(body, type);
		}
		catch (JsonProcessingException e) {
			throw unreadable(path, body, e);
		}
	}

	private static ApiException unreadable(String path, String body, JsonProcessingException e) {
		logger.warn("Unreadable response from {}: {}", path, e.getOriginalMessage());
		return new ApiException("Unexpected response from " + path + ": " + e.getOriginalMessage(), 200, body, e);
	}

}
