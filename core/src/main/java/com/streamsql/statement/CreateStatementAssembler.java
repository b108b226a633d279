package com.streamsql.statement;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.StatementGenerationException;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.generator.ExpressionTranslator;
import com.streamsql.generator.GroupByClauseBuilder;
import com.streamsql.generator.HavingClauseBuilder;
import com.streamsql.generator.SelectClauseBuilder;
import com.streamsql.generator.WhereClauseBuilder;
import com.streamsql.hub.HubProjectionOverride;
import com.streamsql.hub.HubSelectPolicy;
import com.streamsql.hub.ProjectionMetadata;
import com.streamsql.logical.Extras;
import com.streamsql.logical.QueryModel;
import com.streamsql.logical.RenderOptions;
import com.streamsql.logical.SourceDescriptor;
import com.streamsql.logical.SourceKind;
import com.streamsql.statement.ClauseDealiaser.SourceAlias;
import com.streamsql.statement.FromClauseBuilder.FromClause;
import com.streamsql.statement.KeyPathStyler.KeyAlias;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compiles a {@link QueryModel} into a {@code CREATE STREAM|TABLE ... AS SELECT}
 * statement.
 *
 * <p>Compilation runs in fixed phases:
 * <ol>
 *   <li>GROUP BY, SELECT, FROM/JOIN, WHERE and HAVING are rendered by the clause
 *       builders under the {@code o}/{@code i} parameter aliases</li>
 *   <li>an explicit partition list is kept (and later folded into GROUP BY) or dropped</li>
 *   <li>key columns of table sources are rewritten into {@code KEY->col} form</li>
 *   <li>aliases that are not needed are removed</li>
 *   <li>the STREAM/TABLE decision and the WITH clause are made and the text composed</li>
 * </ol>
 *
 * <p>The model is never modified. Derived hub overrides are memoized into its
 * {@link Extras}, which is why one model must not be compiled from two threads at once.
 */
public final class CreateStatementAssembler {

    private static final Logger logger = LoggerFactory.getLogger(CreateStatementAssembler.class);

    private final ExpressionTranslator translator;
    private final HubSelectPolicy hubSelectPolicy;
    private final FromClauseBuilder fromClauseBuilder;

    public CreateStatementAssembler() {
        this(FunctionCatalog.defaults(), CompilerConfig.defaults());
    }

    public CreateStatementAssembler(FunctionCatalog catalog, CompilerConfig config) {
        Objects.requireNonNull(catalog, "catalog must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.translator = new ExpressionTranslator(catalog, config);
        this.hubSelectPolicy = new HubSelectPolicy(catalog);
        this.fromClauseBuilder = new FromClauseBuilder(config);
    }

    public FunctionCatalog catalog() {
        return translator.catalog();
    }

    public CompilerConfig config() {
        return translator.config();
    }

    /**
     * Compiles a statement with default options.
     *
     * @param scope the active compilation scope
     * @param name the target name
     * @param model the query model
     * @return the statement text
     */
    public String build(CompilationScope scope, String name, QueryModel model) {
        return build(scope, CreateRequest.of(name, model));
    }

    /**
     * Compiles a statement.
     *
     * @param scope the active compilation scope
     * @param request the target name, model and rendering options
     * @return the statement text, terminated by {@code ;}
     * @throws com.streamsql.exception.CompilationScopeException if the scope is missing or closed
     * @throws IllegalArgumentException if the name is blank
     * @throws ValidationException if the model violates a precondition
     * @throws UnsupportedOperationException for unsupported constructs and joins over more than two sources
     * @throws StatementGenerationException for any other failure
     */
    public String build(CompilationScope scope, CreateRequest request) {
        CompilationScope.require(scope);
        Objects.requireNonNull(request, "request must not be null");
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Stream name is required");
        }
        try {
            return assemble(request);
        } catch (ValidationException | UnsupportedOperationException
                 | IllegalArgumentException | IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StatementGenerationException("Failed to generate CREATE statement", e, request.name());
        }
    }

    private String assemble(CreateRequest request) {
        QueryModel model = request.model();
        FromClauseBuilder.validateSources(model);
        List<SourceDescriptor> sources = model.sources();
        boolean aliasPrimary = model.primarySourceRequiresAlias();
        RenderOptions options = request.options();

        String groupByKeys = model.groupBy()
            .map(g -> new GroupByClauseBuilder(translator,
                ParameterAliases.forSources(g, sources.size(), aliasPrimary)).build(g.body()))
            .orElse(null);
        String groupBy = groupByKeys == null ? "" : "GROUP BY " + groupByKeys;

        SelectFragment select = buildSelect(model, groupByKeys, options, aliasPrimary);
        FromClause from = fromClauseBuilder.build(model, request.sourceNameResolver(), aliasPrimary);
        String where = model.whereCondition()
            .map(w -> "WHERE " + new WhereClauseBuilder(translator,
                ParameterAliases.forPredicate(w, aliasPrimary)).build(w.body()))
            .orElse("");
        String having = model.having()
            .map(h -> "HAVING " + new HavingClauseBuilder(translator, groupedMembers(model)).build(h.body()))
            .orElse("");

        String partition = resolvePartition(model, request.partitionBy());

        logger.trace("Fragments before key styling: select={}, from={}, where={}, groupBy={}, having={}",
            select.text(), from.text(), where, groupBy, having);

        List<KeyAlias> keyMap = KeyPathStyler.keyAliases(model, options.keyPathStyle());
        String fromText = KeyPathStyler.apply(from.text(), keyMap);
        String selectText = KeyPathStyler.apply(select.text(), keyMap);
        groupBy = KeyPathStyler.apply(groupBy, keyMap);
        partition = KeyPathStyler.apply(partition, keyMap);
        where = KeyPathStyler.apply(where, keyMap);
        having = KeyPathStyler.apply(having, keyMap);

        Map<String, SourceAlias> aliasMetadata = ClauseDealiaser.aliasMetadata(from.aliasToSource(), sources);
        Set<String> ambiguous = ClauseDealiaser.ambiguousColumns(aliasMetadata.values());
        boolean preserveSelectAlias = aliasPrimary || select.forcePreserveAlias();
        if (!preserveSelectAlias && aliasMetadata.size() == 1 && ambiguous.isEmpty()) {
            selectText = ClauseDealiaser.stripSelectAlias(selectText, aliasMetadata.values().iterator().next());
        }
        groupBy = ClauseDealiaser.preferScope(groupBy, aliasMetadata.values(), ambiguous);
        partition = ClauseDealiaser.preferScope(partition, aliasMetadata.values(), ambiguous);
        where = ClauseDealiaser.preferScope(where, aliasMetadata.values(), ambiguous);
        having = ClauseDealiaser.preferScope(having, aliasMetadata.values(), ambiguous);

        boolean merged = false;
        if (partition != null && !partition.isBlank()) {
            partition = PartitionMerger.deduplicate(partition);
            if (!partition.isBlank()) {
                PartitionMerger.Merge merge = PartitionMerger.merge(groupBy, partition);
                groupBy = merge.groupByClause();
                merged = merge.merged();
            }
        }

        logger.trace("Fragments after key styling and dealiasing: select={}, from={}, where={}, groupBy={}, having={}",
            selectText, fromText, where, groupBy, having);

        SourceKind naturalKind = model.determineType(catalog());
        SourceKind kind = naturalKind == SourceKind.TABLE || merged ? SourceKind.TABLE : SourceKind.STREAM;
        logger.debug("Statement {} compiles to {} (model kind {}, partition merged: {})",
            request.name(), kind, naturalKind, merged);

        String with = buildWith(request, naturalKind);

        StringBuilder sb = new StringBuilder();
        sb.append("CREATE ").append(kind.keyword()).append(" IF NOT EXISTS ").append(request.name())
          .append(' ').append(with).append(" AS\n");
        sb.append("SELECT ").append(selectText).append('\n');
        sb.append(fromText);
        appendClause(sb, where);
        appendClause(sb, groupBy);
        appendClause(sb, having);
        sb.append("\nEMIT CHANGES;");
        return sb.toString();
    }

    static void appendClause(StringBuilder sb, String clause) {
        if (clause != null && !clause.isEmpty()) {
            sb.append('\n').append(clause);
        }
    }

    // ==================== SELECT ====================

    private record SelectFragment(String text, boolean forcePreserveAlias) {
    }

    private record HubSelection(Map<String, HubProjectionOverride> overrides, Set<String> excludes) {
    }

    private SelectFragment buildSelect(QueryModel model, String groupByKeys, RenderOptions options,
                                       boolean aliasPrimary) {
        Lambda projection = projectionOf(model);
        if (projection == null) {
            return new SelectFragment("*", false);
        }
        Map<String, String> aliases = ParameterAliases.forSources(projection, model.sources().size(), aliasPrimary);
        SelectClauseBuilder.Builder builder = SelectClauseBuilder.builder(translator)
            .parameterAliases(aliases)
            .groupByKeys(groupByKeys);

        boolean forcePreserve = false;
        if (options.result().isPresent()) {
            builder.decimalHints(options.result().get().decimalHints(config()));
        } else {
            HubSelection hub = resolveHubSelection(model);
            if (hub != null) {
                boolean hasPrimaryAlias = aliases.containsValue(FromClauseBuilder.PRIMARY_ALIAS);
                if (hub.overrides() != null) {
                    builder.overrides(hub.overrides(), hasPrimaryAlias ? FromClauseBuilder.PRIMARY_ALIAS : "");
                    forcePreserve = hasPrimaryAlias;
                }
                if (hub.excludes() != null && !hub.excludes().isEmpty()) {
                    builder.exclude(hub.excludes());
                }
            }
        }
        return new SelectFragment(builder.build().build(projection.body()), forcePreserve);
    }

    /**
     * Returns the projection to render: the hub-adapted one when memoized, else the model's.
     */
    static Lambda projectionOf(QueryModel model) {
        return model.extras().get(Extras.HUB_PROJECTION, Lambda.class)
            .orElse(model.selectProjection().orElse(null));
    }

    static ProjectionMetadata metadataOf(QueryModel model) {
        return model.projectionMetadata()
            .orElse(model.extras().get(Extras.HUB_METADATA, ProjectionMetadata.class).orElse(null));
    }

    @SuppressWarnings("unchecked")
    private HubSelection resolveHubSelection(QueryModel model) {
        Extras extras = model.extras();
        Map<String, HubProjectionOverride> overrides =
            (Map<String, HubProjectionOverride>) extras.get(Extras.SELECT_OVERRIDES, Map.class).orElse(null);
        Set<String> excludes = (Set<String>) extras.get(Extras.SELECT_EXCLUDE, Set.class).orElse(null);
        ProjectionMetadata metadata = metadataOf(model);
        boolean hubInput = metadata != null && metadata.hubInput();

        if (hubInput && (overrides == null || excludes == null)) {
            Set<String> available = (Set<String>) extras.get(Extras.HUB_AVAILABLE_COLUMNS, Set.class).orElse(null);
            HubSelectPolicy.Selection derived = hubSelectPolicy.buildOverridesAndExcludes(metadata, available);
            if (overrides == null) {
                overrides = derived.overrides();
                extras.put(Extras.SELECT_OVERRIDES, overrides);
            } else {
                Map<String, HubProjectionOverride> combined = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                combined.putAll(overrides);
                combined.putAll(derived.overrides());
                overrides = combined;
            }
            if (excludes == null) {
                excludes = derived.excludes();
                extras.put(Extras.SELECT_EXCLUDE, excludes);
            } else {
                Set<String> combined = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
                combined.addAll(excludes);
                combined.addAll(derived.excludes());
                excludes = combined;
            }
            logger.debug("Resolved hub selection: {} overrides, {} exclusions", overrides.size(), excludes.size());
        }

        if (!hubInput && overrides == null && excludes == null) {
            return null;
        }
        return new HubSelection(overrides, excludes);
    }

    // ==================== HAVING ====================

    private static Set<String> groupedMembers(QueryModel model) {
        Set<String> members = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        model.groupBy().ifPresent(g -> collectMembers(g.body(), members));
        return members;
    }

    private static void collectMembers(Expression expression, Set<String> members) {
        if (expression instanceof MemberAccess member) {
            members.add(member.member());
        }
        for (Expression child : ExpressionUtils.children(expression)) {
            collectMembers(child, members);
        }
    }

    // ==================== Partition ====================

    /**
     * Decides whether an explicit partition list is folded into GROUP BY.
     *
     * @return the normalized partition list to merge, or null to drop it
     */
    private String resolvePartition(QueryModel model, String partitionBy) {
        if (partitionBy == null || partitionBy.isBlank()) {
            return null;
        }
        String normalized = PartitionMerger.normalize(partitionBy);
        List<String> columns = PartitionMerger.columnKeys(normalized);
        if (columns.isEmpty()) {
            return null;
        }
        List<SourceDescriptor> sources = model.sources();
        Set<String> primaryKeys = KeyPathStyler.keyNames(sources.get(0));
        boolean matchesKey = PartitionMerger.matchesKey(columns, primaryKeys);
        boolean allStreams = sources.stream().noneMatch(SourceDescriptor::isTable);
        boolean rekeyedStream = allStreams
            && sources.size() == 1
            && !model.hasGroupBy()
            && !model.hasTumbling()
            && !hasEmitFinal(model)
            && !matchesKey;

        if (rekeyedStream || model.hasGroupBy()) {
            logger.debug("Merging partition columns [{}] into GROUP BY", normalized);
            return normalized;
        }
        logger.debug("Dropping partition columns [{}] (matches key: {}, sources: {})",
            normalized, matchesKey, sources.size());
        return null;
    }

    static boolean hasEmitFinal(QueryModel model) {
        return model.extras().getString(Extras.EMIT)
            .map(emit -> emit.toUpperCase(Locale.ROOT).contains("FINAL"))
            .orElse(false);
    }

    // ==================== WITH ====================

    private String buildWith(CreateRequest request, SourceKind naturalKind) {
        QueryModel model = request.model();
        Extras extras = model.extras();
        String valueSchema = request.valueSchemaFullName();
        if (valueSchema == null || valueSchema.isBlank()) {
            valueSchema = extras.getString(Extras.VALUE_SCHEMA_FULL_NAME).orElse(null);
        }
        String cleanupPolicy = extras.getString(Extras.SINK_CLEANUP_POLICY)
            .or(() -> extras.getString(Extras.SINK_CLEANUP_POLICY_DOTTED))
            .orElse(null);
        boolean allowRetention = naturalKind != SourceKind.TABLE || model.hasTumbling();

        return WithClauseBuilder.forTopic(request.name())
            .keyed(model.sources().stream().anyMatch(SourceDescriptor::hasKey))
            .cleanupPolicy(cleanupPolicy)
            .keySchemaFullName(request.keySchemaFullName())
            .valueSchemaFullName(valueSchema)
            .partitions(extras.getPositiveInt(Extras.SINK_PARTITIONS).orElse(null))
            .replicas(extras.getPositiveInt(Extras.SINK_REPLICAS).orElse(null))
            .retentionMs(extras.getPositiveLong(Extras.SINK_RETENTION_MS).orElse(null), allowRetention)
            .build();
    }
}
