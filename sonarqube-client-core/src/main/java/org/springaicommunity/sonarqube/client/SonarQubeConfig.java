package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the SonarQube client and related beans.
 */
@Configuration
public class SonarQubeConfig {

	@Value("${SONAR_HOST_URL:" + SonarQubeClientProperties.DEFAULT_BASE_URL + "}")
	private String sonarHostUrl;

	@Value("${SONAR_TOKEN:}")
	private String sonarToken;

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public SonarQubeTransport sonarQubeTransport(ObjectMapper objectMapper) {
		AuthProvider auth = sonarToken.isBlank() ? NoAuthProvider.INSTANCE : new BearerTokenAuthProvider(sonarToken);
		return new HttpSonarQubeTransport(sonarHostUrl, auth, new SonarQubeClientProperties(),
				new ErrorClassifier(objectMapper));
	}

	@Bean
	public SonarQubeClient sonarQubeClient(SonarQubeTransport sonarQubeTransport, ObjectMapper objectMapper) {
		return new SonarQubeClient(sonarQubeTransport, objectMapper);
	}

}
