package org.springaicommunity.sonarqube.client;

import java.util.Collection;

/**
 * Search builder for {@code api/hotspots/search}. Either a project or a list of hotspot
 * keys must be given.
 */
public final class HotspotSearchBuilder
		extends PaginatedBuilder<HotspotSearchBuilder, HotspotsClient.HotspotSearchResponse, Hotspot> {

	HotspotSearchBuilder(PageExecutor<HotspotsClient.HotspotSearchResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	public HotspotSearchBuilder forProject(String projectKey) {
		return setParam("projectKey", projectKey);
	}

	public HotspotSearchBuilder withHotspots(Collection<String> hotspotKeys) {
		return setParam("hotspots", hotspotKeys);
	}

	public HotspotSearchBuilder withStatus(HotspotStatus status) {
		return setParam("status", status);
	}

	/**
	 * Filter reviewed hotspots on their resolution. Only meaningful together with
	 * {@link HotspotStatus#REVIEWED}.
	 * @param resolution resolution
	 * @return this builder
	 */
	public HotspotSearchBuilder withResolution(HotspotResolution resolution) {
		return setParam("resolution", resolution);
	}

	public HotspotSearchBuilder needingReview() {
		return withStatus(HotspotStatus.TO_REVIEW);
	}

	public HotspotSearchBuilder reviewed() {
		return withStatus(HotspotStatus.REVIEWED);
	}

	public HotspotSearchBuilder onBranch(String branch) {
		Validation.requireAtMostOne("pullRequest", getParam("pullRequest"), "branch", branch);
		return setParam("branch", branch);
	}

	public HotspotSearchBuilder onPullRequest(String pullRequest) {
		Validation.requireAtMostOne("branch", getParam("branch"), "pullRequest", pullRequest);
		return setParam("pullRequest", pullRequest);
	}

	public HotspotSearchBuilder onlyMine() {
		return setParam("onlyMine", true);
	}

	public HotspotSearchBuilder inNewCodePeriod() {
		return setParam("inNewCodePeriod", true);
	}

	public HotspotSearchBuilder inFiles(Collection<String> filePaths) {
		return setParam("files", filePaths);
	}

}
