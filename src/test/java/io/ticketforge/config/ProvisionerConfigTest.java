package io.ticketforge.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

final class ProvisionerConfigTest {

    @Test
    void defaultNamespaceUsesRootDirectly() {
        ProvisionerConfig config = ProvisionerConfig.fromRoot("build/tf-data");
        Path base = Path.of("build/tf-data").toAbsolutePath().normalize();
        Assertions.assertEquals("default", config.namespace());
        Assertions.assertEquals(base, config.rootDir());
        Assertions.assertEquals(base.resolve("ticketforge.db"), config.dbFile());
        Assertions.assertEquals(base.resolve("audit").resolve("audit.log"), config.auditFile());
        Assertions.assertEquals(base.resolve("security").resolve("audit-signing.key"), config.auditSigningKeyFile());
    }

    @Test
    void namedNamespaceIsScopedUnderNamespacesDir() {
        ProvisionerConfig config = ProvisionerConfig.fromRoot("build/tf-data", "Trade Surveillance/2024");
        Path base = Path.of("build/tf-data").toAbsolutePath().normalize();
        Assertions.assertEquals("trade-surveillance-2024", config.namespace());
        Assertions.assertEquals(base.resolve("namespaces").resolve("trade-surveillance-2024"), config.rootDir());
        Assertions.assertEquals(base, config.rootBaseDir());
    }

    @Test
    void namespaceSanitizing() {
        Assertions.assertEquals("default", ProvisionerConfig.sanitizeNamespace(null));
        Assertions.assertEquals("default", ProvisionerConfig.sanitizeNamespace("  "));
        Assertions.assertEquals("default", ProvisionerConfig.sanitizeNamespace("$$"));
        Assertions.assertEquals("ns.hidden", ProvisionerConfig.sanitizeNamespace(".hidden"));
        Assertions.assertEquals("mig-q3", ProvisionerConfig.sanitizeNamespace("MIG  Q3"));
    }
}
