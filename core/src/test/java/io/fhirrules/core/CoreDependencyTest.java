package io.fhirrules.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core module stays free of host-side stacks. The runtime
 * classpath is inspected for known server, persistence and FHIR-server group
 * IDs; hosts bring those themselves through the SPI.
 */
class CoreDependencyTest {

    /** Group IDs that MUST NOT appear on the core classpath. */
    private static final List<String> FORBIDDEN_GROUPS = List.of(
            "io.javalin", // HTTP server
            "org.eclipse.jetty", // servlet container
            "org.springframework", // application framework
            "org.hibernate", // persistence
            "ca.uhn.hapi.fhir" // FHIR server and validator
            );

    @Test
    void coreClasspathContainsNoHostDependencies() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbiddenGroup : FORBIDDEN_GROUPS) {
            String pathFragment = forbiddenGroup.replace('.', '/');
            assertThat(classpath)
                    .as("Core classpath must not contain host dependency: %s", forbiddenGroup)
                    .doesNotContain(pathFragment);
        }
    }
}
