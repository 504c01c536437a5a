package com.adlanda.codecontext;

import com.adlanda.codecontext.config.EmbeddingProperties;
import com.adlanda.codecontext.repository.SourceFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final SourceFileStore fileStore;
    private final EmbeddingProperties embeddingProperties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(SourceFileStore fileStore, EmbeddingProperties embeddingProperties) {
        this.fileStore = fileStore;
        this.embeddingProperties = embeddingProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Code Context Service v{}
            Stored files: {}
            Embedding provider: {} ({})

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/files
              POST http://localhost:{}/api/v1/embeddings/sessions/{sessionId}
              POST http://localhost:{}/api/v1/search
              POST http://localhost:{}/api/v1/context

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, fileStore.count(), embeddingProperties.getProvider(), embeddingProperties.getModel(),
            port, port, port, port, port, port
        );
    }
}
