package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

/**
 * A project, application or portfolio as returned by {@code api/projects}.
 *
 * @param key unique key
 * @param name display name
 * @param qualifier component qualifier, e.g. {@code TRK}
 * @param visibility {@code public} or {@code private}
 * @param lastAnalysisDate date of the last analysis, absent for provisioned projects
 * @param revision SCM revision of the last analysis
 * @param managed whether the project is managed by an external provider
 */
public record Project(String key, String name, @Nullable String qualifier, @Nullable String visibility,
		@Nullable String lastAnalysisDate, @Nullable String revision, @Nullable Boolean managed) {
}
