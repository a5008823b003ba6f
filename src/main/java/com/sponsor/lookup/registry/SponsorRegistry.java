package com.sponsor.lookup.registry;

import com.sponsor.lookup.core.model.SponsorRecord;
import com.sponsor.lookup.rules.DefaultNormalizationRules;
import com.sponsor.lookup.rules.NormalizationEngine;
import com.sponsor.lookup.similarity.BlockingKeyStrategy;
import com.sponsor.lookup.similarity.WordBlockingKeyStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, indexed snapshot of the sponsor register.
 *
 * <p>Holds three views built once by {@link Builder#build()}:</p>
 * <ul>
 *   <li>all records in source order</li>
 *   <li>normalized name to the records sharing it (the same company at several branches)</li>
 *   <li>word index: blocking key to the normalized names containing it</li>
 * </ul>
 *
 * <p>All collections are unmodifiable and fully populated before the instance
 * is published, so a registry can be shared by concurrent searches without locking.
 * Queries must be normalized with {@link #normalize(String)} so they agree with the index keys.</p>
 */
public final class SponsorRegistry {

    private final List<SponsorRecord> sponsors;
    private final Map<String, List<SponsorRecord>> byNormalizedName;
    private final Map<String, Set<String>> wordIndex;
    private final NormalizationEngine normalizer;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final LoadResult loadResult;

    private SponsorRegistry(Builder builder) {
        this.sponsors = List.copyOf(builder.sponsors);
        this.normalizer = builder.normalizer;
        this.blockingKeyStrategy = builder.blockingKeyStrategy;
        this.loadResult = builder.loadResult != null
                ? builder.loadResult
                : new LoadResult(sponsors.size(), sponsors.size(), 0, "memory");

        Map<String, List<SponsorRecord>> names = new LinkedHashMap<>();
        builder.byNormalizedName.forEach((name, records) -> names.put(name, List.copyOf(records)));
        this.byNormalizedName = Collections.unmodifiableMap(names);

        Map<String, Set<String>> words = new LinkedHashMap<>();
        builder.wordIndex.forEach((word, keys) ->
                words.put(word, Collections.unmodifiableSet(new LinkedHashSet<>(keys))));
        this.wordIndex = Collections.unmodifiableMap(words);
    }

    /**
     * Normalizes text exactly as registry names were normalized at load time.
     */
    public String normalize(String text) {
        return normalizer.normalize(text);
    }

    /**
     * Generates word-index keys for normalized text.
     */
    public Set<String> indexKeys(String normalizedText) {
        return blockingKeyStrategy.generateKeys(normalizedText);
    }

    public List<SponsorRecord> sponsors() {
        return sponsors;
    }

    /**
     * Records stored under a normalized name, empty if the name is not indexed.
     */
    public List<SponsorRecord> recordsFor(String normalizedName) {
        return byNormalizedName.getOrDefault(normalizedName, List.of());
    }

    public boolean containsName(String normalizedName) {
        return byNormalizedName.containsKey(normalizedName);
    }

    /**
     * Distinct normalized names in first-seen order.
     */
    public Set<String> normalizedNames() {
        return byNormalizedName.keySet();
    }

    /**
     * Normalized names containing the given word, empty if the word is not indexed.
     */
    public Set<String> namesContaining(String word) {
        return wordIndex.getOrDefault(word, Set.of());
    }

    public Set<String> indexedWords() {
        return wordIndex.keySet();
    }

    public int size() {
        return sponsors.size();
    }

    public boolean isEmpty() {
        return sponsors.isEmpty();
    }

    public int distinctNameCount() {
        return byNormalizedName.size();
    }

    public int indexedWordCount() {
        return wordIndex.size();
    }

    public LoadResult getLoadResult() {
        return loadResult;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates records and their index entries. Not thread-safe; a builder
     * is confined to the loading thread.
     */
    public static class Builder {
        private final List<SponsorRecord> sponsors = new ArrayList<>();
        private final Map<String, List<SponsorRecord>> byNormalizedName = new LinkedHashMap<>();
        private final Map<String, Set<String>> wordIndex = new LinkedHashMap<>();
        private NormalizationEngine normalizer = DefaultNormalizationRules.createNameNormalizer();
        private BlockingKeyStrategy blockingKeyStrategy = new WordBlockingKeyStrategy();
        private LoadResult loadResult;

        public Builder normalizer(NormalizationEngine normalizer) {
            requireEmpty();
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            requireEmpty();
            this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy");
            return this;
        }

        public Builder loadResult(LoadResult loadResult) {
            this.loadResult = loadResult;
            return this;
        }

        /**
         * Appends a record and indexes it under its normalized name and words.
         */
        public Builder add(SponsorRecord record) {
            Objects.requireNonNull(record, "record");
            sponsors.add(record);

            String normalized = normalizer.normalize(record.name());
            byNormalizedName.computeIfAbsent(normalized, k -> new ArrayList<>()).add(record);

            for (String key : blockingKeyStrategy.generateKeys(normalized)) {
                wordIndex.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(normalized);
            }
            return this;
        }

        public Builder addAll(Iterable<SponsorRecord> records) {
            for (SponsorRecord record : records) {
                add(record);
            }
            return this;
        }

        public int size() {
            return sponsors.size();
        }

        public SponsorRegistry build() {
            return new SponsorRegistry(this);
        }

        private void requireEmpty() {
            if (!sponsors.isEmpty()) {
                throw new IllegalStateException("Index configuration must be set before records are added");
            }
        }
    }
}
