package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

/**
 * Component marked as favorite by the authenticated user.
 *
 * @param key component key
 * @param name component name
 * @param qualifier component qualifier, see {@link ComponentQualifier}
 */
public record Favorite(String key, @Nullable String name, @Nullable String qualifier) {
}
