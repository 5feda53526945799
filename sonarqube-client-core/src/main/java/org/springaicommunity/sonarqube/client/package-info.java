/**
 * SonarQube Web API client.
 *
 * <p>
 * Resource clients ({@code *Client}) expose one API area each and hand paginated searches
 * to {@link org.springaicommunity.sonarqube.client.PaginatedBuilder} subclasses. Failed
 * calls surface as exactly one
 * {@link org.springaicommunity.sonarqube.client.SonarQubeException} subtype produced by
 * {@link org.springaicommunity.sonarqube.client.ErrorClassifier}.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.NullMarked;
