package io.github.loregraph.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.loregraph.core.EntityEdge;
import io.github.loregraph.core.EntityGraphExpansionHit;
import io.github.loregraph.core.EntityGraphExplanation;
import io.github.loregraph.core.EntityGraphSettings;
import io.github.loregraph.core.EntityNode;
import io.github.loregraph.core.EvidenceRef;
import io.github.loregraph.core.RelationType;
import io.github.loregraph.core.ResolvedEntity;
import io.github.loregraph.core.SemanticPredicate;
import io.github.loregraph.settings.SettingsProvider;
import io.github.loregraph.utils.Subscription;
import io.github.loregraph.vault.NoteChangeListener;
import io.github.loregraph.vault.NoteFile;
import io.github.loregraph.vault.NoteLink;
import io.github.loregraph.vault.NoteMetadata;
import io.github.loregraph.vault.NoteStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic entity graph built from note metadata.
 *
 * <p>One node per eligible note, keyed by its path. Aliases come from the note name and path,
 * configured front-matter alias fields and the text of outgoing links. Edges come from wiki links
 * (with reciprocal backlinks), front-matter references, semantic front-matter relations, shared
 * tags and shared headings. No text is sent to a model; everything is derived from structure.</p>
 *
 * <p>All graph maps are guarded by one read/write lock. Full rebuilds run on a dedicated thread
 * and concurrent callers share the in-flight rebuild. Note change events update the graph
 * incrementally once it has been built; before that they are ignored.</p>
 */
@ApplicationScoped
public class EntityGraphIndexManager implements NoteChangeListener, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EntityGraphIndexManager.class);

    static final int MAX_RESOLVED_ENTITIES = 8;
    static final int MAX_QUERY_TOKENS = 18;
    static final int MAX_NGRAM_SIZE = 4;
    static final int MIN_PHRASE_LENGTH = 2;
    static final int MAX_SHARED_GROUP_SIZE = 24;
    static final int MIN_TAG_LENGTH = 2;
    static final int MIN_HEADING_LENGTH = 3;
    static final int MAX_HOPS_LIMIT = 4;
    static final int MAX_EXPANDED_DOCS_LIMIT = 100;

    static final double WIKI_LINK_CONFIDENCE = 0.95;
    static final double BACKLINK_CONFIDENCE = 0.90;
    static final double FRONTMATTER_REFERENCE_CONFIDENCE = 0.90;
    static final double SHARED_TAG_CONFIDENCE = 0.70;
    static final double HEADING_COOCCURRENCE_CONFIDENCE = 0.55;

    private static final Pattern QUERY_TOKEN = Pattern.compile("[\\p{L}\\p{N}_-]+");

    private final NoteStore noteStore;
    private final SettingsProvider settingsProvider;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock.
    private final Map<String, EntityNode> nodesById = new LinkedHashMap<>();
    private final Map<String, Set<String>> aliasesToEntityIds = new HashMap<>();
    private final Map<String, Map<String, EntityEdge>> edgesByFrom = new LinkedHashMap<>();
    private final Map<String, String> edgeIdToFromId = new HashMap<>();
    private final Map<String, Set<String>> sourcePathToEdgeIds = new HashMap<>();
    private final Map<String, NoteDescriptor> descriptorsByPath = new LinkedHashMap<>();

    private final ExecutorService rebuildExecutor;
    private final Object rebuildMonitor = new Object();
    // Guarded by rebuildMonitor.
    private CompletableFuture<Void> rebuildInFlight;
    private boolean invalidatedDuringRebuild;

    private volatile boolean initialized;

    private final List<Subscription> subscriptions = new ArrayList<>();

    @Inject
    public EntityGraphIndexManager(NoteStore noteStore, SettingsProvider settingsProvider) {
        this.noteStore = noteStore;
        this.settingsProvider = settingsProvider;
        this.rebuildExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "entity-graph-rebuild");
            thread.setDaemon(true);
            return thread;
        });

        subscriptions.add(noteStore.addChangeListener(this));
        subscriptions.add(settingsProvider.subscribe((previous, next) -> {
            if (previous.affectsIndex(next)) {
                logger.debug("Entity graph settings changed, invalidating index");
                invalidate();
            }
        }));
    }

    /**
     * Rebuilds the index if it is not initialized.
     *
     * @return future completing once the index is ready, or once a failed rebuild has been logged
     */
    public CompletableFuture<Void> ensureReady() {
        synchronized (rebuildMonitor) {
            if (initialized) {
                return CompletableFuture.completedFuture(null);
            }
            return startRebuild();
        }
    }

    /**
     * Marks the index stale without clearing it. The next {@link #ensureReady()} rebuilds.
     */
    public void invalidate() {
        synchronized (rebuildMonitor) {
            initialized = false;
            if (rebuildInFlight != null) {
                invalidatedDuringRebuild = true;
            }
        }
    }

    /**
     * Rebuilds the whole graph from the note store. Joins the in-flight rebuild if there is one.
     */
    public CompletableFuture<Void> rebuild() {
        synchronized (rebuildMonitor) {
            return startRebuild();
        }
    }

    private CompletableFuture<Void> startRebuild() {
        if (rebuildInFlight != null) {
            return rebuildInFlight;
        }
        // Cleared by runRebuild under rebuildMonitor together with the initialized flag.
        rebuildInFlight = CompletableFuture.runAsync(this::runRebuild, rebuildExecutor);
        return rebuildInFlight;
    }

    private void runRebuild() {
        long start = System.currentTimeMillis();
        synchronized (rebuildMonitor) {
            invalidatedDuringRebuild = false;
        }

        boolean succeeded = false;
        try {
            EntityGraphSettings settings = settingsProvider.current();
            List<NoteDescriptor> descriptors = new ArrayList<>();
            for (NoteFile note : noteStore.listNotes()) {
                try {
                    descriptors.add(buildDescriptor(note, settings));
                } catch (RuntimeException e) {
                    logger.warn("Failed to index {}: {}", note.path(), e.getMessage(), e);
                }
            }

            EntityGraphStats stats;
            lock.writeLock().lock();
            try {
                clearAllState();
                for (NoteDescriptor descriptor : descriptors) {
                    upsertDescriptor(descriptor);
                }
                rebuildDirectRelationEdges();
                rebuildSharedRelationEdges();
                stats = statsLocked(true);
            } finally {
                lock.writeLock().unlock();
            }

            succeeded = true;
            logger.info("Rebuilt entity graph: nodes={}, aliases={}, edges={} ({}ms)",
                    stats.nodes(), stats.aliases(), stats.edges(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            logger.warn("Entity graph rebuild failed: {}", e.getMessage(), e);
        } finally {
            synchronized (rebuildMonitor) {
                initialized = succeeded && !invalidatedDuringRebuild;
                rebuildInFlight = null;
            }
        }
    }

    /**
     * Resolves canonical entities named in a free-text query by alias matching.
     *
     * <p>Candidate terms are the whole normalized query plus every 1 to 4 token n-gram over its
     * first 18 tokens. Each matching entity keeps its best-scoring alias. At most 8 results.</p>
     */
    public CompletableFuture<List<ResolvedEntity>> resolveEntities(@Nullable String query) {
        return ensureReady().thenApply(ignored -> resolveNow(query));
    }

    private List<ResolvedEntity> resolveNow(@Nullable String query) {
        String normalizedQuery = AliasNormalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return List.of();
        }

        lock.readLock().lock();
        try {
            Map<String, ResolvedEntity> best = new LinkedHashMap<>();
            for (String term : candidateTerms(normalizedQuery)) {
                Set<String> entityIds = aliasesToEntityIds.get(term);
                if (entityIds == null || entityIds.isEmpty()) {
                    continue;
                }

                double score = termScore(term);
                for (String entityId : entityIds) {
                    EntityNode node = nodesById.get(entityId);
                    if (node == null) {
                        continue;
                    }
                    ResolvedEntity existing = best.get(entityId);
                    if (existing == null || score > existing.score()) {
                        best.put(entityId, new ResolvedEntity(entityId, node.canonicalName(), term, score));
                    }
                }
            }

            List<ResolvedEntity> resolved = new ArrayList<>(best.values());
            resolved.sort(Comparator.comparingDouble(ResolvedEntity::score).reversed());
            return resolved.size() > MAX_RESOLVED_ENTITIES
                    ? List.copyOf(resolved.subList(0, MAX_RESOLVED_ENTITIES))
                    : List.copyOf(resolved);
        } finally {
            lock.readLock().unlock();
        }
    }

    static List<String> candidateTerms(String normalizedQuery) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(normalizedQuery);

        List<String> tokens = new ArrayList<>();
        Matcher matcher = QUERY_TOKEN.matcher(normalizedQuery);
        while (matcher.find() && tokens.size() < MAX_QUERY_TOKENS) {
            tokens.add(matcher.group());
        }

        for (int n = Math.min(MAX_NGRAM_SIZE, tokens.size()); n >= 1; n--) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                String phrase = String.join(" ", tokens.subList(i, i + n)).trim();
                if (phrase.length() >= MIN_PHRASE_LENGTH) {
                    candidates.add(phrase);
                }
            }
        }
        return new ArrayList<>(candidates);
    }

    static double termScore(String term) {
        int tokenCount = 0;
        for (String token : term.split(" ")) {
            if (!token.isEmpty()) {
                tokenCount++;
            }
        }
        return tokenCount * 10 + Math.min(10, term.length() / 4.0);
    }

    /**
     * Expands graph neighbors of resolved entities breadth-first and ranks the reached notes.
     *
     * @param resolvedEntities seeds, traversed from hop 0
     * @param maxHops          hop limit, clamped to [1, 4]
     * @param maxExpandedDocs  result limit, clamped to [1, 100]
     * @return hits sorted by accumulated score, seeds excluded
     */
    @NotNull
    public List<EntityGraphExpansionHit> expandFromResolvedEntities(
            @NotNull List<ResolvedEntity> resolvedEntities, int maxHops, int maxExpandedDocs) {
        if (resolvedEntities.isEmpty()) {
            return List.of();
        }

        int hopLimit = Math.max(1, Math.min(MAX_HOPS_LIMIT, maxHops));
        int docLimit = Math.max(1, Math.min(MAX_EXPANDED_DOCS_LIMIT, maxExpandedDocs));

        Set<String> seedIds = new HashSet<>();
        Deque<Traversal> queue = new ArrayDeque<>();
        for (ResolvedEntity seed : resolvedEntities) {
            seedIds.add(seed.entityId());
            queue.add(new Traversal(seed.entityId(), 0, seed));
        }

        Set<String> visitedStates = new HashSet<>();
        Map<String, ExpansionAccumulator> accumulators = new LinkedHashMap<>();

        lock.readLock().lock();
        try {
            while (!queue.isEmpty()) {
                Traversal current = queue.poll();
                if (current.hop() >= hopLimit) {
                    continue;
                }

                Map<String, EntityEdge> outgoing = edgesByFrom.get(current.nodeId());
                if (outgoing == null || outgoing.isEmpty()) {
                    continue;
                }

                EntityNode currentNode = nodesById.get(current.nodeId());
                String currentName = currentNode != null ? currentNode.canonicalName() : null;

                for (EntityEdge edge : outgoing.values()) {
                    EntityNode nextNode = nodesById.get(edge.getToId());
                    if (nextNode == null) {
                        continue;
                    }

                    int nextHop = current.hop() + 1;
                    double transitionScore = current.seed().score()
                            * edge.getRelation().weight()
                            * edge.getConfidence()
                            / nextHop;
                    String relationPath = (currentName != null && !currentName.isEmpty() ? currentName : edge.getFromId())
                            + " --" + edge.relationLabel() + "--> " + nextNode.canonicalName();

                    accumulators.computeIfAbsent(edge.getToId(), id -> new ExpansionAccumulator(nextHop))
                            .accept(edge, current.seed(), nextHop, transitionScore, relationPath);

                    String stateKey = edge.getToId() + ":" + nextHop + ":" + current.seed().entityId();
                    if (visitedStates.add(stateKey)) {
                        queue.add(new Traversal(edge.getToId(), nextHop, current.seed()));
                    }
                }
            }

            List<EntityGraphExpansionHit> hits = new ArrayList<>();
            for (Map.Entry<String, ExpansionAccumulator> entry : accumulators.entrySet()) {
                if (seedIds.contains(entry.getKey())) {
                    continue;
                }
                EntityNode node = nodesById.get(entry.getKey());
                if (node == null) {
                    continue;
                }
                ExpansionAccumulator accumulator = entry.getValue();
                hits.add(new EntityGraphExpansionHit(node.path(), node.canonicalName(), accumulator.score,
                        accumulator.toExplanation()));
            }

            hits.sort(Comparator.comparingDouble(EntityGraphExpansionHit::score).reversed());
            return hits.size() > docLimit ? List.copyOf(hits.subList(0, docLimit)) : List.copyOf(hits);
        } finally {
            lock.readLock().unlock();
        }
    }

    @NotNull
    public Optional<EntityNode> getNode(@NotNull String entityId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodesById.get(entityId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies of the edges leaving a node, empty for unknown ids.
     */
    @NotNull
    public List<EntityEdge> getOutgoingEdges(@NotNull String entityId) {
        lock.readLock().lock();
        try {
            Map<String, EntityEdge> outgoing = edgesByFrom.get(entityId);
            return outgoing == null ? List.of() : outgoing.values().stream().map(EntityEdge::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    @NotNull
    public EntityGraphStats getStats() {
        lock.readLock().lock();
        try {
            return statsLocked(initialized);
        } finally {
            lock.readLock().unlock();
        }
    }

    private EntityGraphStats statsLocked(boolean initializedFlag) {
        int edgeCount = 0;
        for (Map<String, EntityEdge> outgoing : edgesByFrom.values()) {
            edgeCount += outgoing.size();
        }
        return new EntityGraphStats(nodesById.size(), aliasesToEntityIds.size(), edgeCount, initializedFlag);
    }

    @Override
    public void onNoteModified(@NotNull NoteFile note) {
        if (!initialized) {
            return;
        }

        if (!noteStore.isEligible(note)) {
            lock.writeLock().lock();
            try {
                removeDescriptor(note.path());
                rebuildAllEdges();
            } finally {
                lock.writeLock().unlock();
            }
            return;
        }

        NoteDescriptor descriptor;
        try {
            descriptor = buildDescriptor(note, settingsProvider.current());
        } catch (RuntimeException e) {
            logger.warn("Failed to index {}: {}", note.path(), e.getMessage(), e);
            return;
        }

        lock.writeLock().lock();
        try {
            upsertDescriptor(descriptor);
            rebuildAllEdges();
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Re-indexed {}", note.path());
    }

    @Override
    public void onNoteCreated(@NotNull NoteFile note) {
        onNoteModified(note);
    }

    @Override
    public void onNoteRenamed(@NotNull NoteFile note, @NotNull String oldPath) {
        if (!initialized) {
            return;
        }

        if (!oldPath.isEmpty() && !oldPath.equals(note.path())) {
            lock.writeLock().lock();
            try {
                removeDescriptor(oldPath);
            } finally {
                lock.writeLock().unlock();
            }
        }
        onNoteModified(note);
    }

    @Override
    public void onNoteDeleted(@NotNull String path) {
        if (!initialized) {
            return;
        }

        lock.writeLock().lock();
        try {
            removeDescriptor(path);
            rebuildAllEdges();
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Removed {} from entity graph", path);
    }

    /**
     * Unregisters the note and settings listeners and stops the rebuild thread.
     */
    @PreDestroy
    @Override
    public void close() {
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        rebuildExecutor.shutdown();
    }

    private NoteDescriptor buildDescriptor(NoteFile note, EntityGraphSettings settings) {
        String path = note.path();
        NoteMetadata metadata = noteStore.getMetadata(path).orElseGet(NoteMetadata::empty);
        ObjectNode frontmatter = metadata.frontmatter();

        Set<String> aliases = new LinkedHashSet<>();
        aliases.add(AliasNormalizer.normalize(note.basename()));
        aliases.add(AliasNormalizer.normalize(path));
        for (String aliasField : settings.aliasFields()) {
            FrontmatterWalker.forEachListedString(frontmatter.get(aliasField), value -> {
                String alias = AliasNormalizer.normalize(value);
                if (!alias.isEmpty()) {
                    aliases.add(alias);
                }
            });
        }

        Set<String> tags = new LinkedHashSet<>();
        for (String tag : metadata.tags()) {
            tags.add(AliasNormalizer.normalize(tag));
        }
        Set<String> headings = new LinkedHashSet<>();
        for (String heading : metadata.headings()) {
            headings.add(AliasNormalizer.normalize(heading));
        }

        Set<String> outgoingTargets = new LinkedHashSet<>();
        for (NoteLink link : metadata.links()) {
            if (link.link().isEmpty()) {
                continue;
            }
            resolveNotePath(link.link(), path)
                    .filter(resolved -> !resolved.equals(path))
                    .ifPresent(outgoingTargets::add);

            String linkAlias = AliasNormalizer.normalize(link.displayText() != null ? link.displayText() : link.link());
            if (!linkAlias.isEmpty()) {
                aliases.add(linkAlias);
            }
        }

        Set<String> frontmatterTargets = new LinkedHashSet<>();
        for (String candidate : frontmatterReferenceCandidates(frontmatter)) {
            resolveNotePath(candidate, path)
                    .filter(resolved -> !resolved.equals(path))
                    .ifPresent(frontmatterTargets::add);
        }

        return new NoteDescriptor(path, note.basename(), note.mtime(), tags, headings,
                outgoingTargets, frontmatterTargets, aliases,
                extractSemanticRelations(frontmatter, path, settings));
    }

    private List<NoteDescriptor.SemanticRelation> extractSemanticRelations(
            ObjectNode frontmatter, String sourcePath, EntityGraphSettings settings) {
        if (!settings.enableSemanticRelations()) {
            return List.of();
        }

        List<SemanticRelationCandidate> candidates = SemanticRelationExtractor.extract(
                frontmatter, sourcePath, settings.semanticRelationFields(),
                candidate -> resolveNotePath(candidate, sourcePath));

        Map<String, NoteDescriptor.SemanticRelation> deduped = new LinkedHashMap<>();
        for (SemanticRelationCandidate candidate : candidates) {
            NoteDescriptor.SemanticRelation relation = new NoteDescriptor.SemanticRelation(
                    candidate.targetPath(),
                    candidate.predicate(),
                    candidate.fractionConfidence(settings.semanticMinConfidence()),
                    candidate.sourceField());
            String key = relation.targetPath() + "|" + relation.predicate().id();
            NoteDescriptor.SemanticRelation existing = deduped.get(key);
            if (existing == null || relation.confidence() > existing.confidence()) {
                deduped.put(key, relation);
            }
        }
        return new ArrayList<>(deduped.values());
    }

    private static Set<String> frontmatterReferenceCandidates(ObjectNode frontmatter) {
        Set<String> candidates = new LinkedHashSet<>();
        FrontmatterWalker.forEachString(frontmatter, value -> {
            List<String> wikiTargets = WikiLinks.extractTargets(value);
            if (!wikiTargets.isEmpty()) {
                candidates.addAll(wikiTargets);
                return;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty() && (trimmed.contains("/") || trimmed.endsWith(".md"))) {
                candidates.add(trimmed);
            }
        });
        return candidates;
    }

    private Optional<String> resolveNotePath(String candidate, String sourcePath) {
        String trimmed = candidate.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return noteStore.resolveLink(trimmed, sourcePath);
    }

    // --- Mutations below require the write lock. ---

    private void upsertDescriptor(NoteDescriptor descriptor) {
        removeDescriptor(descriptor.path());

        EntityNode node = new EntityNode(descriptor.path(), descriptor.title(), descriptor.aliases(),
                descriptor.mtime(), descriptor.tags());
        nodesById.put(node.id(), node);
        descriptorsByPath.put(descriptor.path(), descriptor);

        for (String alias : descriptor.aliases()) {
            addAlias(alias, node.id());
        }
    }

    private void removeDescriptor(String path) {
        NoteDescriptor existing = descriptorsByPath.get(path);
        if (existing == null) {
            return;
        }

        for (String alias : existing.aliases()) {
            removeAlias(alias, path);
        }
        removeEdgesFromSourcePath(path);
        removeEdgesReferencingNode(path);

        nodesById.remove(path);
        descriptorsByPath.remove(path);
    }

    private void rebuildAllEdges() {
        rebuildDirectRelationEdges();
        rebuildSharedRelationEdges();
    }

    private void rebuildDirectRelationEdges() {
        removeEdgesByRelation(RelationType.WIKI_LINK);
        removeEdgesByRelation(RelationType.BACKLINK);
        removeEdgesByRelation(RelationType.FRONTMATTER_REFERENCE);
        removeEdgesByRelation(RelationType.SEMANTIC_FRONTMATTER);
        sourcePathToEdgeIds.clear();

        for (NoteDescriptor descriptor : descriptorsByPath.values()) {
            String path = descriptor.path();
            String chunkId = path + "#0";

            EvidenceRef linkEvidence = new EvidenceRef(path, chunkId, descriptor.mtime(), RelationType.WIKI_LINK);
            EvidenceRef backlinkEvidence = linkEvidence.withExtractor(RelationType.BACKLINK);
            for (String target : descriptor.outgoingTargets()) {
                addEdge(path, target, RelationType.WIKI_LINK, WIKI_LINK_CONFIDENCE, linkEvidence, path, null);
                addEdge(target, path, RelationType.BACKLINK, BACKLINK_CONFIDENCE, backlinkEvidence, path, null);
            }

            EvidenceRef referenceEvidence = linkEvidence.withExtractor(RelationType.FRONTMATTER_REFERENCE);
            for (String target : descriptor.frontmatterTargets()) {
                addEdge(path, target, RelationType.FRONTMATTER_REFERENCE, FRONTMATTER_REFERENCE_CONFIDENCE,
                        referenceEvidence, path, null);
            }

            EvidenceRef semanticEvidence = linkEvidence.withExtractor(RelationType.SEMANTIC_FRONTMATTER);
            for (NoteDescriptor.SemanticRelation relation : descriptor.semanticRelations()) {
                addEdge(path, relation.targetPath(), RelationType.SEMANTIC_FRONTMATTER, relation.confidence(),
                        semanticEvidence, path, relation.predicate());
            }
        }
    }

    private void rebuildSharedRelationEdges() {
        removeEdgesByRelation(RelationType.SHARED_TAG);
        removeEdgesByRelation(RelationType.HEADING_COOCCURRENCE);

        Map<String, Set<String>> tagGroups = new LinkedHashMap<>();
        Map<String, Set<String>> headingGroups = new LinkedHashMap<>();

        for (NoteDescriptor descriptor : descriptorsByPath.values()) {
            for (String tag : descriptor.tags()) {
                if (tag.length() < MIN_TAG_LENGTH) {
                    continue;
                }
                String key = tag.startsWith("#") ? tag : "#" + tag;
                tagGroups.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(descriptor.path());
            }
            for (String heading : descriptor.headings()) {
                if (heading.length() < MIN_HEADING_LENGTH) {
                    continue;
                }
                headingGroups.computeIfAbsent(heading, k -> new LinkedHashSet<>()).add(descriptor.path());
            }
        }

        buildPairwiseSharedEdges(tagGroups, RelationType.SHARED_TAG, SHARED_TAG_CONFIDENCE);
        buildPairwiseSharedEdges(headingGroups, RelationType.HEADING_COOCCURRENCE, HEADING_COOCCURRENCE_CONFIDENCE);
    }

    private void buildPairwiseSharedEdges(Map<String, Set<String>> groups, RelationType relation, double confidence) {
        for (Set<String> group : groups.values()) {
            List<String> members = new ArrayList<>(group);
            if (members.size() > MAX_SHARED_GROUP_SIZE) {
                members = members.subList(0, MAX_SHARED_GROUP_SIZE);
            }
            if (members.size() < 2) {
                continue;
            }

            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    EntityNode from = nodesById.get(members.get(i));
                    EntityNode to = nodesById.get(members.get(j));
                    if (from == null || to == null) {
                        continue;
                    }
                    addEdge(from.id(), to.id(), relation, confidence,
                            new EvidenceRef(from.id(), from.id() + "#0", from.mtime(), relation), null, null);
                    addEdge(to.id(), from.id(), relation, confidence,
                            new EvidenceRef(to.id(), to.id() + "#0", to.mtime(), relation), null, null);
                }
            }
        }
    }

    private void addEdge(String fromId, String toId, RelationType relation, double confidence,
                         EvidenceRef evidence, @Nullable String sourcePath,
                         @Nullable SemanticPredicate semanticPredicate) {
        if (fromId.equals(toId) || !nodesById.containsKey(fromId) || !nodesById.containsKey(toId)) {
            return;
        }

        String edgeId = EntityEdge.edgeId(fromId, relation, semanticPredicate, toId);
        Map<String, EntityEdge> outgoing = edgesByFrom.computeIfAbsent(fromId, k -> new LinkedHashMap<>());
        EntityEdge existing = outgoing.get(edgeId);
        if (existing == null) {
            outgoing.put(edgeId, new EntityEdge(fromId, toId, relation, confidence, semanticPredicate, evidence));
            edgeIdToFromId.put(edgeId, fromId);
        } else {
            existing.mergeEvidence(evidence);
        }

        if (sourcePath != null) {
            sourcePathToEdgeIds.computeIfAbsent(sourcePath, k -> new LinkedHashSet<>()).add(edgeId);
        }
    }

    private void removeEdgesFromSourcePath(String path) {
        Set<String> edgeIds = sourcePathToEdgeIds.remove(path);
        if (edgeIds == null) {
            return;
        }

        for (String edgeId : edgeIds) {
            String fromId = edgeIdToFromId.remove(edgeId);
            if (fromId == null) {
                continue;
            }
            Map<String, EntityEdge> outgoing = edgesByFrom.get(fromId);
            if (outgoing == null) {
                continue;
            }
            outgoing.remove(edgeId);
            if (outgoing.isEmpty()) {
                edgesByFrom.remove(fromId);
            }
        }
    }

    private void removeEdgesReferencingNode(String nodeId) {
        Map<String, EntityEdge> outgoing = edgesByFrom.remove(nodeId);
        if (outgoing != null) {
            outgoing.keySet().forEach(edgeIdToFromId::remove);
        }

        Iterator<Map.Entry<String, Map<String, EntityEdge>>> groups = edgesByFrom.entrySet().iterator();
        while (groups.hasNext()) {
            Map<String, EntityEdge> edges = groups.next().getValue();
            Iterator<Map.Entry<String, EntityEdge>> it = edges.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, EntityEdge> entry = it.next();
                if (entry.getValue().getToId().equals(nodeId)) {
                    it.remove();
                    edgeIdToFromId.remove(entry.getKey());
                }
            }
            if (edges.isEmpty()) {
                groups.remove();
            }
        }
    }

    private void removeEdgesByRelation(RelationType relation) {
        Iterator<Map.Entry<String, Map<String, EntityEdge>>> groups = edgesByFrom.entrySet().iterator();
        while (groups.hasNext()) {
            Map<String, EntityEdge> edges = groups.next().getValue();
            Iterator<Map.Entry<String, EntityEdge>> it = edges.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, EntityEdge> entry = it.next();
                if (entry.getValue().getRelation() == relation) {
                    it.remove();
                    edgeIdToFromId.remove(entry.getKey());
                }
            }
            if (edges.isEmpty()) {
                groups.remove();
            }
        }
    }

    private void clearAllState() {
        nodesById.clear();
        aliasesToEntityIds.clear();
        edgesByFrom.clear();
        edgeIdToFromId.clear();
        sourcePathToEdgeIds.clear();
        descriptorsByPath.clear();
    }

    private void addAlias(String alias, String entityId) {
        String normalized = AliasNormalizer.normalize(alias);
        if (normalized.isEmpty()) {
            return;
        }
        aliasesToEntityIds.computeIfAbsent(normalized, k -> new LinkedHashSet<>()).add(entityId);
    }

    private void removeAlias(String alias, String entityId) {
        String normalized = AliasNormalizer.normalize(alias);
        Set<String> bucket = aliasesToEntityIds.get(normalized);
        if (bucket == null) {
            return;
        }
        bucket.remove(entityId);
        if (bucket.isEmpty()) {
            aliasesToEntityIds.remove(normalized);
        }
    }

    private record Traversal(String nodeId, int hop, ResolvedEntity seed) {
    }

    private static final class ExpansionAccumulator {

        private double score;
        private int hopDepth;
        private final Set<RelationType> relationTypes = new LinkedHashSet<>();
        private final Set<String> matchedEntities = new LinkedHashSet<>();
        private final List<String> relationPaths = new ArrayList<>();
        private final List<EvidenceRef> evidenceRefs = new ArrayList<>();
        private int evidenceCount;

        ExpansionAccumulator(int hopDepth) {
            this.hopDepth = hopDepth;
        }

        void accept(EntityEdge edge, ResolvedEntity seed, int hop, double transitionScore, String relationPath) {
            score += transitionScore;
            hopDepth = Math.min(hopDepth, hop);
            relationTypes.add(edge.getRelation());
            matchedEntities.add(seed.canonicalName());
            if (relationPaths.size() < EntityGraphExplanation.MAX_RELATION_PATHS && !relationPaths.contains(relationPath)) {
                relationPaths.add(relationPath);
            }

            List<EvidenceRef> evidence = edge.getEvidence();
            for (EvidenceRef ref : evidence) {
                if (evidenceRefs.size() < EntityGraphExplanation.MAX_EVIDENCE_REFS
                        && evidenceRefs.stream().noneMatch(existing -> existing.sameSourceAs(ref))) {
                    evidenceRefs.add(ref);
                }
            }
            evidenceCount += evidence.size();
        }

        EntityGraphExplanation toExplanation() {
            return new EntityGraphExplanation(
                    new ArrayList<>(matchedEntities),
                    new ArrayList<>(relationTypes),
                    hopDepth,
                    evidenceCount,
                    relationPaths,
                    evidenceRefs,
                    score);
        }
    }
}
