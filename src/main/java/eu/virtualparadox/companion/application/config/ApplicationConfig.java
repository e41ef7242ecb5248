package eu.virtualparadox.companion.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root of the {@code companion.*} configuration tree.
 * <p>Storage folders default to sub-directories of {@link #root} when they are not set explicitly.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "companion")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path db;
    private Path blob;
    private Path models;

    private final Retrieval retrieval = new Retrieval();
    private final History history = new History();
    private final Embedding embedding = new Embedding();
    private final Generation generation = new Generation();
    private final Ollama ollama = new Ollama();
    private final OpenAi openai = new OpenAi();
    private final Ingestion ingestion = new Ingestion();
    private final Chat chat = new Chat();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root == null) {
            root = Path.of(System.getProperty("user.home"), ".companion");
        }
        if (index == null) index = root.resolve("index");
        if (blob == null) blob = root.resolve("blobs");
        if (models == null) models = root.resolve("models");

        Files.createDirectories(root);
        Files.createDirectories(index);
        Files.createDirectories(blob);
        if (db != null) {
            Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
    }

    @Getter @Setter
    public static class Retrieval {
        /** Number of chunks folded into the prompt. */
        private int topK = 4;
    }

    @Getter @Setter
    public static class History {
        private int maxMessages = 10;
        private int maxChars = 12_000;
    }

    @Getter @Setter
    public static class Embedding {
        /** One of {@code hashing}, {@code onnx}, {@code ollama}, {@code openai}. */
        private String backend = "hashing";
        private int dimensions = 384;
        private int batchSize = 32;
    }

    @Getter @Setter
    public static class Generation {
        private List<String> priority = new ArrayList<>(List.of("ollama", "openai"));
        private Duration firstFragmentTimeout = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofSeconds(30);
        private double temperature = 0.7;
        private final Mock mock = new Mock();
    }

    @Getter @Setter
    public static class Mock {
        private boolean enabled = false;
        private Duration delay = Duration.ofMillis(20);
    }

    @Getter @Setter
    public static class Ollama {
        private boolean enabled = true;
        private String baseUrl = "http://127.0.0.1:11434";
        private String model = "llama3.1:8b";
        private String embeddingModel = "all-minilm";
    }

    @Getter @Setter
    public static class OpenAi {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private String embeddingModel = "text-embedding-3-small";
    }

    @Getter @Setter
    public static class Ingestion {
        private int threads = 2;
        private int queueCapacity = 100;
    }

    @Getter @Setter
    public static class Chat {
        /** Fragments buffered between the generator and a slow SSE client. */
        private int streamBuffer = 256;
        private Duration responseTimeout = Duration.ofMinutes(5);
        private Duration sseTimeout = Duration.ofMinutes(10);
    }
}
