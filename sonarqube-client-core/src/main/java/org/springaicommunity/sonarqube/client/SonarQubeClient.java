package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Entry point to the SonarQube Web API. Holds one client per API area, all sharing the
 * same transport and {@link ObjectMapper}.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * SonarQubeClient client = SonarQubeClient.builder()
 *     .baseUrl("https://sonar.example.com")
 *     .tokenFromEnv()
 *     .build();
 *
 * client.issues().search()
 *     .withProjects(List.of("my-project"))
 *     .onlyUnresolved()
 *     .stream()
 *     .forEach(issue -> System.out.println(issue.message()));
 * }
 * </pre>
 */
public class SonarQubeClient {

	private final SonarQubeTransport transport;

	private final DeprecationRegistry deprecations;

	private final ProjectsClient projects;

	private final IssuesClient issues;

	private final HotspotsClient hotspots;

	private final ComponentsClient components;

	private final RulesClient rules;

	private final MeasuresClient measures;

	private final QualityGatesClient qualityGates;

	private final SourcesClient sources;

	private final AuditLogsClient auditLogs;

	private final CeClient ce;

	private final FavoritesClient favorites;

	private final MetricsClient metrics;

	private final NotificationsClient notifications;

	private final SystemClient system;

	private final AuthenticationClient authentication;

	@SuppressWarnings("deprecation")
	private final UserPropertiesClient userProperties;

	public SonarQubeClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		this(transport, objectMapper, new DeprecationRegistry(DeprecationPolicy.WARN));
	}

	@SuppressWarnings("deprecation")
	public SonarQubeClient(SonarQubeTransport transport, ObjectMapper objectMapper, DeprecationRegistry deprecations) {
		this.transport = Objects.requireNonNull(transport, "transport");
		this.deprecations = Objects.requireNonNull(deprecations, "deprecations");
		Objects.requireNonNull(objectMapper, "objectMapper");
		this.projects = new ProjectsClient(transport, objectMapper);
		this.issues = new IssuesClient(transport, objectMapper, deprecations);
		this.hotspots = new HotspotsClient(transport, objectMapper);
		this.components = new ComponentsClient(transport, objectMapper);
		this.rules = new RulesClient(transport, objectMapper);
		this.measures = new MeasuresClient(transport, objectMapper);
		this.qualityGates = new QualityGatesClient(transport, objectMapper);
		this.sources = new SourcesClient(transport, objectMapper);
		this.auditLogs = new AuditLogsClient(transport, objectMapper);
		this.ce = new CeClient(transport, objectMapper);
		this.favorites = new FavoritesClient(transport, objectMapper);
		this.metrics = new MetricsClient(transport, objectMapper);
		this.notifications = new NotificationsClient(transport, objectMapper);
		this.system = new SystemClient(transport, objectMapper);
		this.authentication = new AuthenticationClient(transport, objectMapper);
		this.userProperties = new UserPropertiesClient(transport, objectMapper);
	}

	public static SonarQubeClientBuilder builder() {
		return SonarQubeClientBuilder.create();
	}

	public SonarQubeTransport getTransport() {
		return transport;
	}

	/**
	 * Deprecated usages seen by this client.
	 * @return the registry shared by every resource client
	 */
	public DeprecationRegistry deprecations() {
		return deprecations;
	}

	public ProjectsClient projects() {
		return projects;
	}

	public IssuesClient issues() {
		return issues;
	}

	public HotspotsClient hotspots() {
		return hotspots;
	}

	public ComponentsClient components() {
		return components;
	}

	public RulesClient rules() {
		return rules;
	}

	public MeasuresClient measures() {
		return measures;
	}

	public QualityGatesClient qualityGates() {
		return qualityGates;
	}

	public SourcesClient sources() {
		return sources;
	}

	/**
	 * Audit logs, Enterprise Edition and above.
	 * @return the audit logs client
	 * @see AuditLogsClient#isAvailable()
	 */
	public AuditLogsClient auditLogs() {
		return auditLogs;
	}

	public CeClient ce() {
		return ce;
	}

	public FavoritesClient favorites() {
		return favorites;
	}

	public MetricsClient metrics() {
		return metrics;
	}

	public NotificationsClient notifications() {
		return notifications;
	}

	public SystemClient system() {
		return system;
	}

	public AuthenticationClient authentication() {
		return authentication;
	}

	/**
	 * @deprecated the endpoint was removed in SonarQube 6.3, see {@link #favorites()} and
	 * {@link #notifications()}
	 */
	@Deprecated
	public UserPropertiesClient userProperties() {
		return userProperties;
	}

}
