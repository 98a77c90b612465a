package com.pinery.ai;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM profiles and conversion-selector settings, stored as YAML.
 * Instances are passed to the components that need them; there is no shared global copy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiConfig {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private List<AiProfile> profiles = new ArrayList<>();
    private String defaultProfileId = null;
    private SelectorSettings selector = new SelectorSettings();

    public AiConfig() {
    }

    // ==================== Profile Management ====================

    public List<AiProfile> getProfiles() {
        return profiles;
    }

    public void setProfiles(List<AiProfile> profiles) {
        this.profiles = profiles != null ? profiles : new ArrayList<>();
    }

    public String getDefaultProfileId() {
        return defaultProfileId;
    }

    public void setDefaultProfileId(String defaultProfileId) {
        this.defaultProfileId = defaultProfileId;
    }

    @JsonIgnore
    public AiProfile getDefaultProfile() {
        if (profiles.isEmpty()) return null;
        if (defaultProfileId != null) {
            for (AiProfile p : profiles) {
                if (defaultProfileId.equals(p.getId())) return p;
            }
        }
        return profiles.get(0);
    }

    public AiProfile getProfile(String id) {
        for (AiProfile p : profiles) {
            if (id != null && id.equals(p.getId())) return p;
        }
        return null;
    }

    public void addProfile(AiProfile profile) {
        profiles.add(profile);
    }

    public void removeProfile(String id) {
        profiles.removeIf(p -> id != null && id.equals(p.getId()));
        if (id != null && id.equals(defaultProfileId)) {
            defaultProfileId = profiles.isEmpty() ? null : profiles.get(0).getId();
        }
    }

    public SelectorSettings getSelector() {
        return selector;
    }

    public void setSelector(SelectorSettings selector) {
        this.selector = selector != null ? selector : new SelectorSettings();
    }

    // ==================== Persistence ====================

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        YAML.writeValue(path.toFile(), this);
    }

    public static AiConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("AI config not found: " + path);
        }
        return YAML.readValue(path.toFile(), AiConfig.class);
    }

    /**
     * Load when the file exists, otherwise defaults with no profiles.
     */
    public static AiConfig loadOrDefault(Path path) throws IOException {
        return Files.exists(path) ? load(path) : new AiConfig();
    }

    // ==================== Selector ====================

    /**
     * Routing, retry, cache and batch settings of the strategy selector.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SelectorSettings {
        private int cacheTtlDays = 30;
        private int llmMaxRetries = 3;
        private int hybridMaxRetries = 2;
        private boolean verifyRuleBased = false;
        private boolean acceptUnverifiedDraft = false;
        private boolean costOptimization = true;
        private int batchThreads = 4;
        private String cacheDirectory = null;

        public int getCacheTtlDays() {
            return cacheTtlDays;
        }

        public void setCacheTtlDays(int cacheTtlDays) {
            this.cacheTtlDays = cacheTtlDays;
        }

        public int getLlmMaxRetries() {
            return llmMaxRetries;
        }

        public void setLlmMaxRetries(int llmMaxRetries) {
            this.llmMaxRetries = llmMaxRetries;
        }

        public int getHybridMaxRetries() {
            return hybridMaxRetries;
        }

        public void setHybridMaxRetries(int hybridMaxRetries) {
            this.hybridMaxRetries = hybridMaxRetries;
        }

        public boolean isVerifyRuleBased() {
            return verifyRuleBased;
        }

        public void setVerifyRuleBased(boolean verifyRuleBased) {
            this.verifyRuleBased = verifyRuleBased;
        }

        public boolean isAcceptUnverifiedDraft() {
            return acceptUnverifiedDraft;
        }

        public void setAcceptUnverifiedDraft(boolean acceptUnverifiedDraft) {
            this.acceptUnverifiedDraft = acceptUnverifiedDraft;
        }

        public boolean isCostOptimization() {
            return costOptimization;
        }

        public void setCostOptimization(boolean costOptimization) {
            this.costOptimization = costOptimization;
        }

        public int getBatchThreads() {
            return batchThreads;
        }

        public void setBatchThreads(int batchThreads) {
            this.batchThreads = batchThreads;
        }

        public String getCacheDirectory() {
            return cacheDirectory;
        }

        public void setCacheDirectory(String cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
        }
    }
}
