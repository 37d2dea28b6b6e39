package org.contextql.engine.service;

import org.contextql.dsl.ContextParser;
import org.contextql.dsl.ContextSerializer;
import org.contextql.engine.cache.ResultCache;
import org.contextql.engine.repository.ActiveContextConflictException;
import org.contextql.engine.repository.ContextNotFoundException;
import org.contextql.engine.repository.ContextRepository;
import org.contextql.engine.repository.StoredContext;
import org.contextql.engine.repository.VersionConflictException;
import org.contextql.engine.validation.ContextValidationException;
import org.contextql.engine.validation.ContextValidator;
import org.contextql.engine.validation.ValidationResult;
import org.contextql.engine.validation.ValidationStatus;
import org.contextql.model.ContextDocument;
import org.contextql.model.ContextStatus;
import org.contextql.model.ContextType;
import org.contextql.model.DatasetRef;
import org.contextql.model.GlossaryEntry;
import org.contextql.model.Metric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle and catalog operations over stored contexts.
 *
 * Every version is created as {@code draft}. {@link #activate} promotes a
 * version only after it validates, deprecating the previously active version
 * of the same context. Contexts are private to their owner: other users get
 * {@link ContextNotFoundException}.
 */
public class ContextService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextService.class);

    private final ContextRepository repository;
    private final ContextValidator validator;
    private final ResultCache cache;
    private final Clock clock;

    public ContextService(ContextRepository repository, ContextValidator validator, ResultCache cache, Clock clock) {
        this.repository = repository;
        this.validator = validator;
        this.cache = cache;
        this.clock = clock;
    }

    public ContextService(ContextRepository repository, ContextValidator validator, ResultCache cache) {
        this(repository, validator, cache, Clock.systemUTC());
    }

    // ==================== Lifecycle ====================

    /**
     * Parses and validates a new context, storing it as a draft.
     *
     * @throws VersionConflictException if that id and version already exist
     */
    public StoredContext create(String userId, String text) {
        ContextDocument document = ContextParser.parse(text).withStatus(ContextStatus.DRAFT);
        List<StoredContext> existing = repository.versions(document.id());
        if (!existing.isEmpty() && !existing.get(0).isOwnedBy(userId)) {
            throw new VersionConflictException(document.id(), document.version());
        }
        return saveDraft(userId, document);
    }

    /**
     * Stores an edited context as a new draft version and evicts the context's
     * cached results.
     *
     * @throws ContextNotFoundException  if the context does not exist for the user
     * @throws VersionConflictException  if the text reuses an existing version number
     * @throws IllegalArgumentException  if the text declares a different context id
     */
    public StoredContext update(String userId, String contextId, String text) {
        requireOwned(userId, contextId);
        ContextDocument document = ContextParser.parse(text).withStatus(ContextStatus.DRAFT);
        if (!document.id().equals(contextId)) {
            throw new IllegalArgumentException("Document declares context '" + document.id()
                    + "', expected '" + contextId + "'");
        }
        StoredContext saved = saveDraft(userId, document);
        cache.evictContext(contextId);
        return saved;
    }

    /**
     * Re-validates a version and makes it the active one.
     *
     * @throws ContextValidationException     if validation fails; the version stays draft
     * @throws ActiveContextConflictException if another context is active for one of its datasets
     * @throws RuntimeException               if the repository cannot store the version; the
     *                                        previously active version is active again
     */
    public StoredContext activate(String userId, String contextId, String version) {
        StoredContext target = get(userId, contextId, version);
        if (target.status() == ContextStatus.DEPRECATED) {
            throw new IllegalStateException("Context '" + contextId + "' v" + version + " is deprecated");
        }
        Instant now = clock.instant();
        ValidationResult result = validator.validate(target.document(), userId).result();
        if (result.blocksActivation()) {
            repository.save(target.withValidation(result, now));
            LOGGER.warn("Activation of context {} v{} refused: {} error(s)", contextId, version,
                    result.errors().size());
            throw new ContextValidationException(contextId, result);
        }
        for (DatasetRef dataset : target.document().datasets()) {
            repository.findActiveByDataset(dataset.externalDatasetId())
                    .filter(other -> !other.contextId().equals(contextId))
                    .ifPresent(other -> {
                        throw new ActiveContextConflictException(dataset.externalDatasetId(),
                                other.contextId(), other.version());
                    });
        }
        Optional<StoredContext> previous = repository.active(contextId)
                .filter(p -> !p.version().equals(version));
        if (previous.isPresent()) {
            repository.save(previous.get().withStatus(ContextStatus.DEPRECATED, now));
            LOGGER.info("Context {} v{} deprecated", contextId, previous.get().version());
        }
        StoredContext activated = target.withValidation(result, now).withStatus(ContextStatus.ACTIVE, now);
        try {
            repository.save(activated);
        } catch (RuntimeException e) {
            // the previous version stays active when the new one cannot be stored
            previous.ifPresent(repository::save);
            LOGGER.warn("Activation of context {} v{} failed, {} restored", contextId, version,
                    previous.map(p -> "v" + p.version()).orElse("nothing"), e);
            throw e;
        }
        cache.evictContext(contextId);
        LOGGER.info("Context {} v{} activated", contextId, version);
        return activated;
    }

    public ValidationResult validate(String userId, ContextDocument document) {
        return validator.validate(document, userId).result();
    }

    private StoredContext saveDraft(String userId, ContextDocument document) {
        if (repository.get(document.id(), document.version()).isPresent()) {
            throw new VersionConflictException(document.id(), document.version());
        }
        ValidationResult result = validator.validate(document, userId).result();
        if (result.status() == ValidationStatus.FAILED) {
            LOGGER.warn("Context {} v{} saved with {} validation error(s)", document.id(), document.version(),
                    result.errors().size());
        }
        StoredContext stored = new StoredContext(document, result, userId, clock.instant());
        repository.save(stored);
        LOGGER.info("Context {} v{} saved as draft", document.id(), document.version());
        return stored;
    }

    // ==================== Lookup ====================

    public StoredContext get(String userId, String contextId, String version) {
        return repository.get(contextId, version)
                .filter(c -> c.isOwnedBy(userId))
                .orElseThrow(() -> new ContextNotFoundException(contextId, version));
    }

    /**
     * @return The latest saved version of the context
     */
    public StoredContext get(String userId, String contextId) {
        return requireOwned(userId, contextId);
    }

    /**
     * @param status Only versions in this status, or every version when null
     */
    public List<StoredContext> list(String userId, ContextStatus status) {
        return repository.list().stream()
                .filter(c -> c.isOwnedBy(userId))
                .filter(c -> status == null || c.status() == status)
                .toList();
    }

    public String renderSource(String userId, String contextId, String version) {
        return ContextSerializer.serialize(get(userId, contextId, version).document());
    }

    // ==================== Catalog ====================

    public List<GlossaryMatch> searchGlossary(String userId, String term) {
        List<GlossaryMatch> matches = new ArrayList<>();
        for (StoredContext context : latestVersions(userId)) {
            ContextDocument document = context.document();
            for (GlossaryEntry entry : document.glossary()) {
                if (entry.matches(term)) {
                    matches.add(new GlossaryMatch(document.id(), document.name(), document.version(), entry));
                }
            }
        }
        return matches;
    }

    /**
     * Metrics of the user's contexts that include the dataset. A metric scoped
     * to specific datasets is returned only when the dataset is among them.
     */
    public List<MetricMatch> metricsForDataset(String userId, String externalDatasetId) {
        List<MetricMatch> matches = new ArrayList<>();
        for (StoredContext context : latestVersions(userId)) {
            ContextDocument document = context.document();
            Optional<DatasetRef> dataset = document.findDatasetByExternalId(externalDatasetId);
            if (dataset.isEmpty()) {
                continue;
            }
            for (Metric metric : document.metrics()) {
                if (metric.appliesTo(dataset.get().localId())) {
                    matches.add(new MetricMatch(document.id(), document.version(), dataset.get().localId(), metric));
                }
            }
        }
        return matches;
    }

    public ContextStatistics statistics(String userId) {
        int total = 0;
        int single = 0;
        int multi = 0;
        int active = 0;
        int failed = 0;
        for (StoredContext context : latestVersions(userId)) {
            total++;
            if (context.document().type() == ContextType.MULTI_DATASET) {
                multi++;
            } else {
                single++;
            }
            if (repository.active(context.contextId()).isPresent()) {
                active++;
            }
            if (context.validation() != null && context.validation().status() == ValidationStatus.FAILED) {
                failed++;
            }
        }
        return new ContextStatistics(total, single, multi, active, failed);
    }

    private List<StoredContext> latestVersions(String userId) {
        Map<String, StoredContext> latest = new LinkedHashMap<>();
        for (StoredContext context : repository.list()) {
            if (context.isOwnedBy(userId)) {
                latest.put(context.contextId(), context);
            }
        }
        return new ArrayList<>(latest.values());
    }

    private StoredContext requireOwned(String userId, String contextId) {
        return repository.latest(contextId)
                .filter(c -> c.isOwnedBy(userId))
                .orElseThrow(() -> new ContextNotFoundException(contextId));
    }
}
