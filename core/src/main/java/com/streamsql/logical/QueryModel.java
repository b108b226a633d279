package com.streamsql.logical;

import com.streamsql.expression.Lambda;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.hub.ProjectionMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed query model compiled into a streaming-SQL statement.
 *
 * <p>Built once by the query DSL and read-only to the compiler: every field is
 * final and every collection immutable. The only writable part is {@link #extras()},
 * which carries caller settings and memoized derived values. Each {@link Builder#build()}
 * takes its own copy of the builder's extras.
 *
 * <p>Clause lambdas take one parameter per source in source order (the join
 * condition takes two); a grouped projection or HAVING lambda takes a single
 * grouping parameter.
 */
public final class QueryModel {

    private final List<SourceDescriptor> sources;
    private final Lambda joinCondition;
    private final Lambda whereCondition;
    private final Lambda groupBy;
    private final Lambda having;
    private final Lambda selectProjection;
    private final ProjectionMetadata projectionMetadata;
    private final List<String> windows;
    private final Integer withinSeconds;
    private final boolean forbidDefaultWithin;
    private final Integer graceSeconds;
    private final boolean primarySourceRequiresAlias;
    private final HoppingWindow hopping;
    private final Extras extras;

    private QueryModel(Builder b) {
        this.sources = List.copyOf(b.sources);
        this.joinCondition = b.joinCondition;
        this.whereCondition = b.whereCondition;
        this.groupBy = b.groupBy;
        this.having = b.having;
        this.selectProjection = b.selectProjection;
        this.projectionMetadata = b.projectionMetadata;
        this.windows = normalizeWindows(b.windows);
        this.withinSeconds = b.withinSeconds;
        this.forbidDefaultWithin = b.forbidDefaultWithin;
        this.graceSeconds = b.graceSeconds;
        this.primarySourceRequiresAlias = b.primarySourceRequiresAlias != null
            ? b.primarySourceRequiresAlias
            : b.sources.size() > 1;
        this.hopping = b.hopping;
        this.extras = new Extras(b.extras.asMap());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the distinct timeframes ordered by duration.
     */
    static List<String> normalizeWindows(List<String> windows) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(windows));
        distinct.sort(Comparator.comparingLong(TimeframeUtils::toSeconds));
        return Collections.unmodifiableList(distinct);
    }

    public List<SourceDescriptor> sources() {
        return sources;
    }

    public Optional<Lambda> joinCondition() {
        return Optional.ofNullable(joinCondition);
    }

    public Optional<Lambda> whereCondition() {
        return Optional.ofNullable(whereCondition);
    }

    public Optional<Lambda> groupBy() {
        return Optional.ofNullable(groupBy);
    }

    public Optional<Lambda> having() {
        return Optional.ofNullable(having);
    }

    public Optional<Lambda> selectProjection() {
        return Optional.ofNullable(selectProjection);
    }

    public Optional<ProjectionMetadata> projectionMetadata() {
        return Optional.ofNullable(projectionMetadata);
    }

    public List<String> windows() {
        return windows;
    }

    public Optional<Integer> withinSeconds() {
        return Optional.ofNullable(withinSeconds);
    }

    public boolean forbidDefaultWithin() {
        return forbidDefaultWithin;
    }

    public Optional<Integer> graceSeconds() {
        return Optional.ofNullable(graceSeconds);
    }

    public boolean primarySourceRequiresAlias() {
        return primarySourceRequiresAlias;
    }

    public Optional<HoppingWindow> hopping() {
        return Optional.ofNullable(hopping);
    }

    public Extras extras() {
        return extras;
    }

    public boolean hasGroupBy() {
        return groupBy != null;
    }

    public boolean hasTumbling() {
        return !windows.isEmpty();
    }

    public boolean hasHopping() {
        return hopping != null;
    }

    /**
     * Returns true if the projection contains an aggregate call.
     *
     * @param catalog the function catalog that defines aggregates
     * @return true for aggregating projections
     */
    public boolean hasAggregates(FunctionCatalog catalog) {
        return selectProjection != null && catalog.containsAggregate(selectProjection);
    }

    /**
     * Returns true if the query groups, windows or aggregates.
     *
     * @param catalog the function catalog that defines aggregates
     * @return true for aggregate queries
     */
    public boolean isAggregateQuery(FunctionCatalog catalog) {
        return hasGroupBy() || hasTumbling() || hasHopping() || hasAggregates(catalog);
    }

    /**
     * Returns the natural output kind: TABLE for aggregate queries, else STREAM.
     *
     * @param catalog the function catalog that defines aggregates
     * @return the output kind
     */
    public SourceKind determineType(FunctionCatalog catalog) {
        return isAggregateQuery(catalog) ? SourceKind.TABLE : SourceKind.STREAM;
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>();
        for (SourceDescriptor source : sources) {
            names.add(source.sourceName());
        }
        return "QueryModel[sources=" + names
            + ", join=" + (joinCondition != null)
            + ", where=" + (whereCondition != null)
            + ", groupBy=" + (groupBy != null)
            + ", having=" + (having != null)
            + ", windows=" + windows
            + ", hopping=" + (hopping != null) + "]";
    }

    /**
     * Builder for {@link QueryModel}.
     */
    public static final class Builder {

        private final List<SourceDescriptor> sources = new ArrayList<>();
        private Lambda joinCondition;
        private Lambda whereCondition;
        private Lambda groupBy;
        private Lambda having;
        private Lambda selectProjection;
        private ProjectionMetadata projectionMetadata;
        private final List<String> windows = new ArrayList<>();
        private Integer withinSeconds;
        private boolean forbidDefaultWithin;
        private Integer graceSeconds;
        private Boolean primarySourceRequiresAlias;
        private HoppingWindow hopping;
        private Extras extras = new Extras();

        private Builder() {
        }

        public Builder source(SourceDescriptor source) {
            sources.add(Objects.requireNonNull(source, "source must not be null"));
            return this;
        }

        /**
         * Adds a join target and its condition.
         *
         * @param target the joined source
         * @param condition a two-parameter equality predicate; may be null to model a missing condition
         * @return this builder
         */
        public Builder join(SourceDescriptor target, Lambda condition) {
            sources.add(Objects.requireNonNull(target, "target must not be null"));
            this.joinCondition = condition;
            return this;
        }

        public Builder where(Lambda condition) {
            this.whereCondition = condition;
            return this;
        }

        public Builder groupBy(Lambda keySelector) {
            this.groupBy = keySelector;
            return this;
        }

        public Builder having(Lambda condition) {
            this.having = condition;
            return this;
        }

        public Builder select(Lambda projection) {
            this.selectProjection = projection;
            return this;
        }

        public Builder projectionMetadata(ProjectionMetadata metadata) {
            this.projectionMetadata = metadata;
            return this;
        }

        public Builder windows(String... timeframes) {
            windows.addAll(List.of(timeframes));
            return this;
        }

        public Builder within(int seconds) {
            this.withinSeconds = seconds;
            return this;
        }

        public Builder forbidDefaultWithin(boolean forbid) {
            this.forbidDefaultWithin = forbid;
            return this;
        }

        public Builder grace(int seconds) {
            this.graceSeconds = seconds;
            return this;
        }

        public Builder primarySourceRequiresAlias(boolean requiresAlias) {
            this.primarySourceRequiresAlias = requiresAlias;
            return this;
        }

        public Builder hopping(HoppingWindow window) {
            this.hopping = window;
            return this;
        }

        public Builder extras(Extras value) {
            this.extras = Objects.requireNonNull(value, "extras must not be null");
            return this;
        }

        public Builder extra(String key, Object value) {
            extras.put(key, value);
            return this;
        }

        public QueryModel build() {
            return new QueryModel(this);
        }
    }
}
