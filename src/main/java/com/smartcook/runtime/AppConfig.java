package com.smartcook.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.smartcook.query.RankingPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private HashingConfig hashing = new HashingConfig();
    private ReductionConfig reduction = new ReductionConfig();
    private BuildConfig build = new BuildConfig();
    private QueryConfig query = new QueryConfig();
    private StorageConfig storage = new StorageConfig();

    public HashingConfig getHashing() {
        return hashing;
    }

    public void setHashing(HashingConfig hashing) {
        this.hashing = hashing == null ? new HashingConfig() : hashing;
    }

    public ReductionConfig getReduction() {
        return reduction;
    }

    public void setReduction(ReductionConfig reduction) {
        this.reduction = reduction == null ? new ReductionConfig() : reduction;
    }

    public BuildConfig getBuild() {
        return build;
    }

    public void setBuild(BuildConfig build) {
        this.build = build == null ? new BuildConfig() : build;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HashingConfig {
        private int dimension = 1 << 18;

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReductionConfig {
        private int components = 100;
        private int oversamples = 10;
        private int powerIterations = 5;
        private long seed = 42L;

        public int getComponents() {
            return components;
        }

        public void setComponents(int components) {
            this.components = components;
        }

        public int getOversamples() {
            return oversamples;
        }

        public void setOversamples(int oversamples) {
            this.oversamples = oversamples;
        }

        public int getPowerIterations() {
            return powerIterations;
        }

        public void setPowerIterations(int powerIterations) {
            this.powerIterations = powerIterations;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BuildConfig {
        private int chunkSize = 50_000;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private int maxTitleLength = 0;
        private int maxDirectionsLength = 0;
        private int maxLinkLength = 0;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getMaxTitleLength() {
            return maxTitleLength;
        }

        public void setMaxTitleLength(int maxTitleLength) {
            this.maxTitleLength = maxTitleLength;
        }

        public int getMaxDirectionsLength() {
            return maxDirectionsLength;
        }

        public void setMaxDirectionsLength(int maxDirectionsLength) {
            this.maxDirectionsLength = maxDirectionsLength;
        }

        public int getMaxLinkLength() {
            return maxLinkLength;
        }

        public void setMaxLinkLength(int maxLinkLength) {
            this.maxLinkLength = maxLinkLength;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int candidatePoolSize = 100;
        private int topN = 5;
        private int minRecipeIngredients = 3;
        private int minUsedIngredients = 2;
        private int minCoveragePercent = 30;

        public int getCandidatePoolSize() {
            return candidatePoolSize;
        }

        public void setCandidatePoolSize(int candidatePoolSize) {
            this.candidatePoolSize = candidatePoolSize;
        }

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }

        public int getMinRecipeIngredients() {
            return minRecipeIngredients;
        }

        public void setMinRecipeIngredients(int minRecipeIngredients) {
            this.minRecipeIngredients = minRecipeIngredients;
        }

        public int getMinUsedIngredients() {
            return minUsedIngredients;
        }

        public void setMinUsedIngredients(int minUsedIngredients) {
            this.minUsedIngredients = minUsedIngredients;
        }

        public int getMinCoveragePercent() {
            return minCoveragePercent;
        }

        public void setMinCoveragePercent(int minCoveragePercent) {
            this.minCoveragePercent = minCoveragePercent;
        }

        public RankingPolicy toPolicy() {
            return new RankingPolicy(candidatePoolSize, topN, minRecipeIngredients, minUsedIngredients, minCoveragePercent);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String generationsRoot = ".smartcook/generations";
        private String registryPath = ".smartcook/generation-registry.json";

        public String getGenerationsRoot() {
            return generationsRoot;
        }

        public void setGenerationsRoot(String generationsRoot) {
            this.generationsRoot = generationsRoot;
        }

        public String getRegistryPath() {
            return registryPath;
        }

        public void setRegistryPath(String registryPath) {
            this.registryPath = registryPath;
        }
    }
}
