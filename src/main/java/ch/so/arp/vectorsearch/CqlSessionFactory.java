package ch.so.arp.vectorsearch;

import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;

/**
 * Opens the {@link CqlSession} used by {@link WideColumnSimilaritySearch}. A
 * secure connect bundle is used when one is configured and present on disk;
 * otherwise the session connects to the configured host and port.
 */
class CqlSessionFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(CqlSessionFactory.class);

    private final VectorSearchProperties.WideColumn properties;

    CqlSessionFactory(VectorSearchProperties.WideColumn properties) {
        this.properties = properties;
    }

    CqlSession open() {
        return configure(CqlSession.builder()).build();
    }

    CqlSessionBuilder configure(CqlSessionBuilder builder) {
        Path bundle = secureConnectBundle();
        if (bundle != null) {
            LOGGER.info("Connecting with secure connect bundle {}", bundle);
            builder.withCloudSecureConnectBundle(bundle);
        } else {
            LOGGER.info("Connecting to {}:{} (datacenter {})", properties.getHost(), properties.getPort(),
                    properties.getLocalDatacenter());
            builder.addContactPoint(new InetSocketAddress(properties.getHost(), properties.getPort()))
                    .withLocalDatacenter(properties.getLocalDatacenter());
        }
        if (StringUtils.hasText(properties.getUsername())) {
            builder.withAuthCredentials(properties.getUsername(),
                    properties.getPassword() == null ? "" : properties.getPassword());
        }
        return builder;
    }

    /**
     * @return the bundle path, or {@code null} when host and port should be used
     */
    Path secureConnectBundle() {
        String configured = properties.getSecureConnectBundle();
        if (!StringUtils.hasText(configured)) {
            return null;
        }
        Path bundle = Path.of(configured);
        if (!Files.isRegularFile(bundle)) {
            LOGGER.warn("Secure connect bundle {} does not exist, falling back to host and port", bundle);
            return null;
        }
        return bundle;
    }
}
