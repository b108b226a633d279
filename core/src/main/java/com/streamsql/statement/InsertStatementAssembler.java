package com.streamsql.statement;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.StatementGenerationException;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.Lambda;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.generator.ExpressionTranslator;
import com.streamsql.generator.GroupByClauseBuilder;
import com.streamsql.generator.HavingClauseBuilder;
import com.streamsql.generator.SelectClauseBuilder;
import com.streamsql.generator.WhereClauseBuilder;
import com.streamsql.logical.QueryModel;
import com.streamsql.logical.SourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Compiles a {@link QueryModel} into {@code INSERT INTO target SELECT ...} for a
 * sink that already exists.
 *
 * <p>Unlike {@link CreateStatementAssembler} the primary source is always aliased
 * {@code o}, no key styling or dealiasing is applied and no WITH clause is emitted.
 */
public final class InsertStatementAssembler {

    private static final Logger logger = LoggerFactory.getLogger(InsertStatementAssembler.class);

    private final ExpressionTranslator translator;
    private final FromClauseBuilder fromClauseBuilder;

    public InsertStatementAssembler() {
        this(FunctionCatalog.defaults(), CompilerConfig.defaults());
    }

    public InsertStatementAssembler(FunctionCatalog catalog, CompilerConfig config) {
        this.translator = new ExpressionTranslator(
            Objects.requireNonNull(catalog, "catalog must not be null"),
            Objects.requireNonNull(config, "config must not be null"));
        this.fromClauseBuilder = new FromClauseBuilder(config);
    }

    public String build(CompilationScope scope, String targetName, QueryModel model) {
        return build(scope, targetName, model, SourceDescriptor::sourceName);
    }

    /**
     * Compiles an INSERT statement.
     *
     * @param scope the active compilation scope
     * @param targetName the existing stream or table
     * @param model the query model
     * @param sourceNameResolver maps a source to its FROM/JOIN identifier
     * @return the statement text
     */
    public String build(CompilationScope scope, String targetName, QueryModel model,
                        Function<SourceDescriptor, String> sourceNameResolver) {
        CompilationScope.require(scope);
        if (targetName == null || targetName.isBlank()) {
            throw new IllegalArgumentException("Target name is required");
        }
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(sourceNameResolver, "sourceNameResolver must not be null");
        try {
            return assemble(targetName, model, sourceNameResolver);
        } catch (ValidationException | UnsupportedOperationException
                 | IllegalArgumentException | IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StatementGenerationException("Failed to generate INSERT statement", e, targetName);
        }
    }

    private String assemble(String targetName, QueryModel model, Function<SourceDescriptor, String> resolver) {
        FromClauseBuilder.validateSources(model);

        String groupByKeys = model.groupBy()
            .map(g -> new GroupByClauseBuilder(translator).build(g.body()))
            .orElse(null);

        String select = "*";
        Lambda projection = model.selectProjection().orElse(null);
        if (projection != null) {
            select = SelectClauseBuilder.builder(translator)
                .parameterAliases(ParameterAliases.forSources(projection, model.sources().size(), true))
                .groupByKeys(groupByKeys)
                .build()
                .build(projection.body());
        }

        String from = fromClauseBuilder.build(model, resolver, true).text();
        String where = model.whereCondition()
            .map(w -> "WHERE " + new WhereClauseBuilder(translator,
                ParameterAliases.forPredicate(w, true)).build(w.body()))
            .orElse("");
        String having = model.having()
            .map(h -> "HAVING " + new HavingClauseBuilder(translator).build(h.body()))
            .orElse("");

        StringBuilder sb = new StringBuilder();
        sb.append("INSERT INTO ").append(targetName).append(" SELECT ").append(select).append('\n');
        sb.append(from);
        CreateStatementAssembler.appendClause(sb, where);
        CreateStatementAssembler.appendClause(sb, groupByKeys == null ? "" : "GROUP BY " + groupByKeys);
        CreateStatementAssembler.appendClause(sb, having);
        sb.append("\nEMIT CHANGES;");

        logger.debug("Compiled INSERT INTO {} from {} source(s)", targetName, model.sources().size());
        return sb.toString();
    }
}
