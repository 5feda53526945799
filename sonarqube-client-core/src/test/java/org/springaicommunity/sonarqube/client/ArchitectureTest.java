package org.springaicommunity.sonarqube.client;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Resource clients → SonarQubeTransport (NOT the HTTP implementation)
 *   Query builders  → PageExecutor
 *   Decorators      → Interface they decorate
 *   Spring          → SonarQubeConfig only
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.sonarqube.client",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule resource_clients_should_not_depend_on_http_transport = noClasses().that()
		.areAssignableTo(ResourceClient.class)
		.should()
		.dependOnClassesThat()
		.haveSimpleName("HttpSonarQubeTransport")
		.orShould()
		.dependOnClassesThat()
		.resideInAPackage("java.net.http..")
		.because("Resource clients should depend on the SonarQubeTransport interface");

	@ArchTest
	static final ArchRule query_builders_should_not_depend_on_transport = noClasses().that()
		.areAssignableTo(PaginatedBuilder.class)
		.should()
		.dependOnClassesThat()
		.areAssignableTo(SonarQubeTransport.class)
		.because("Query builders reach the server only through their PageExecutor");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule transports_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("SonarQubeTransport")
		.and()
		.doNotHaveSimpleName("SonarQubeTransport")
		.should()
		.implement(SonarQubeTransport.class)
		.because("All *SonarQubeTransport classes should implement the SonarQubeTransport interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_transport = noClasses().that()
		.haveSimpleName("RetryingSonarQubeTransport")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("HttpSonarQubeTransport")
		.because("Decorators should depend on the SonarQubeTransport interface, not concrete implementation");

	// ========== Hierarchy Rules ==========

	@ArchTest
	static final ArchRule clients_should_extend_resource_client = classes().that()
		.haveSimpleNameEndingWith("Client")
		.and()
		.areTopLevelClasses()
		.and()
		.doNotHaveSimpleName("SonarQubeClient")
		.and()
		.doNotHaveSimpleName("ResourceClient")
		.should()
		.beAssignableTo(ResourceClient.class)
		.because("Resource groups share the mapping done in ResourceClient");

	@ArchTest
	static final ArchRule exceptions_should_extend_base = classes().that()
		.haveSimpleNameEndingWith("Exception")
		.should()
		.beAssignableTo(SonarQubeException.class)
		.because("Callers only ever handle SonarQubeException");

	// ========== Framework Independence ==========

	@ArchTest
	static final ArchRule only_config_should_use_spring = noClasses().that()
		.doNotHaveSimpleName("SonarQubeConfig")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("The client is usable without Spring; SonarQubeConfig is the only integration point");

}
