package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/hotspots}.
 */
public class HotspotsClient extends ResourceClient {

	static final String SEARCH_PATH = "/api/hotspots/search";

	public HotspotsClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public HotspotSearchBuilder search() {
		return new HotspotSearchBuilder(this::search);
	}

	public HotspotSearchResponse search(QueryParameters params) {
		if (!params.contains("projectKey") && !params.contains("hotspots")) {
			throw new ValidationException("Either projectKey or hotspots is required", "projectKey");
		}
		return getJson(SEARCH_PATH, params, HotspotSearchResponse.class);
	}

	public HotspotDetails show(String hotspotKey) {
		QueryParameters query = QueryParameters.create()
			.set("hotspot", Validation.requireNonBlank(hotspotKey, "hotspot"));
		return getJson("/api/hotspots/show", query, HotspotDetails.class);
	}

	/**
	 * Review a hotspot or send it back to review.
	 * @param hotspotKey hotspot key
	 * @param status new status
	 * @param resolution required for {@link HotspotStatus#REVIEWED}, rejected otherwise
	 * @param comment optional review comment
	 */
	public void changeStatus(String hotspotKey, HotspotStatus status, @Nullable HotspotResolution resolution,
			@Nullable String comment) {
		if (status == HotspotStatus.REVIEWED && resolution == null) {
			throw new ValidationException("resolution is required when status is REVIEWED", "resolution");
		}
		if (status == HotspotStatus.TO_REVIEW && resolution != null) {
			throw new ValidationException("resolution must not be set when status is TO_REVIEW", "resolution");
		}
		QueryParameters form = QueryParameters.create()
			.set("hotspot", Validation.requireNonBlank(hotspotKey, "hotspot"))
			.set("status", status)
			.set("resolution", resolution)
			.set("comment", comment);
		post("/api/hotspots/change_status", form);
	}

	/**
	 * Page of {@code api/hotspots/search}.
	 */
	public record HotspotSearchResponse(List<Hotspot> hotspots, @Nullable Paging paging) implements Paged<Hotspot> {

		public HotspotSearchResponse {
			hotspots = hotspots != null ? List.copyOf(hotspots) : List.of();
		}

		@Override
		public List<Hotspot> items() {
			return hotspots;
		}

	}

}
