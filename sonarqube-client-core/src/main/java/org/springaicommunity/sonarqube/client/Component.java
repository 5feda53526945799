package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A component: project, directory, file, application or portfolio.
 *
 * @param key unique key
 * @param name short name
 * @param qualifier component qualifier, e.g. {@code TRK} or {@code FIL}
 * @param longName fully qualified name
 * @param path path relative to the project root, for directories and files
 * @param language language key, for files
 * @param description description, for projects
 * @param visibility {@code public} or {@code private}, for projects
 * @param tags project tags, possibly empty
 */
public record Component(String key, @Nullable String name, @Nullable String qualifier, @Nullable String longName,
		@Nullable String path, @Nullable String language, @Nullable String description, @Nullable String visibility,
		List<String> tags) {

	public Component {
		tags = tags != null ? List.copyOf(tags) : List.of();
	}

}
