package org.springaicommunity.sonarqube.client;

/**
 * Impact of an issue on one software quality.
 *
 * @param softwareQuality e.g. {@code MAINTAINABILITY}
 * @param severity e.g. {@code HIGH}
 */
public record Impact(String softwareQuality, String severity) {
}
