package org.learningjava.carbonengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private final Matcher matcher = new Matcher();
    private final Assistant assistant = new Assistant();
    private final Batch batch = new Batch();
    private final Factors factors = new Factors();
    private final Llm llm = new Llm();

    public Matcher getMatcher() { return matcher; }
    public Assistant getAssistant() { return assistant; }
    public Batch getBatch() { return batch; }
    public Factors getFactors() { return factors; }
    public Llm getLlm() { return llm; }

    public static class Matcher {
        private double minSimilarity = 0.60;
        private double acceptThreshold = 0.60;
        private double highConfidence = 0.75;
        private int maxResults = 5;

        public double getMinSimilarity() { return minSimilarity; }
        public void setMinSimilarity(double v) { this.minSimilarity = v; }
        public double getAcceptThreshold() { return acceptThreshold; }
        public void setAcceptThreshold(double v) { this.acceptThreshold = v; }
        public double getHighConfidence() { return highConfidence; }
        public void setHighConfidence(double v) { this.highConfidence = v; }
        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int v) { this.maxResults = v; }
    }

    public static class Assistant {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(30);
        private int retries = 1;
        private int poolSize = 4;
        private double defaultConfidence = 0.95;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration v) { this.timeout = v; }
        public int getRetries() { return retries; }
        public void setRetries(int v) { this.retries = v; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int v) { this.poolSize = v; }
        public double getDefaultConfidence() { return defaultConfidence; }
        public void setDefaultConfidence(double v) { this.defaultConfidence = v; }
    }

    public static class Batch {
        private int chunkSize = 10;
        private Duration pause = Duration.ofSeconds(1);

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int v) { this.chunkSize = v; }
        public Duration getPause() { return pause; }
        public void setPause(Duration v) { this.pause = v; }
    }

    public static class Factors {
        /** "memory" or "weaviate" */
        private String store = "memory";
        private String seedFile = "classpath:emission-factors.json";
        private boolean loadOnStartup = true;

        public String getStore() { return store; }
        public void setStore(String v) { this.store = v; }
        public String getSeedFile() { return seedFile; }
        public void setSeedFile(String v) { this.seedFile = v; }
        public boolean isLoadOnStartup() { return loadOnStartup; }
        public void setLoadOnStartup(boolean v) { this.loadOnStartup = v; }
    }

    public static class Llm {
        private String provider = "openrouter";
        private String extractionModel = "openai/gpt-4o-mini";
        private String assistantModel = "openai/gpt-4o-mini";

        public String getProvider() { return provider; }
        public void setProvider(String v) { this.provider = v; }
        public String getExtractionModel() { return extractionModel; }
        public void setExtractionModel(String v) { this.extractionModel = v; }
        public String getAssistantModel() { return assistantModel; }
        public void setAssistantModel(String v) { this.assistantModel = v; }
    }
}
