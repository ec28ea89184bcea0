package io.dbmaint.model;

import io.dbmaint.sql.Identifiers;

import java.util.Objects;

/**
 * How rows are removed from a table.
 *
 * <ul>
 *   <li>{@link None}: no delete step.</li>
 *   <li>{@link Truncate}: unconditional single statement, never batched.</li>
 *   <li>{@link Condition}: operator-supplied raw predicate.</li>
 *   <li>{@link OlderThan}: predicate computed as {@code dateColumn < today - days}.</li>
 *   <li>{@link Invalid}: configuration defect detected at load time; reported and skipped.</li>
 * </ul>
 *
 * <p>Predicates from configuration are trusted operator input and are placed into statement
 * text verbatim; see {@link io.dbmaint.spi.SqlDialect}.
 */
public sealed interface DeleteStrategy
        permits DeleteStrategy.None, DeleteStrategy.Truncate, DeleteStrategy.Condition,
        DeleteStrategy.OlderThan, DeleteStrategy.Invalid {

    String DEFAULT_DATE_COLUMN = "date";

    None NONE = new None();
    Truncate TRUNCATE = new Truncate();

    record None() implements DeleteStrategy {
    }

    record Truncate() implements DeleteStrategy {
    }

    /**
     * @param predicate raw {@code WHERE} clause body, never blank
     * @param batching  batch size and pacing
     */
    record Condition(String predicate, BatchSettings batching) implements DeleteStrategy {
        public Condition {
            Objects.requireNonNull(predicate, "predicate");
            if (predicate.isBlank()) {
                throw new IllegalArgumentException("predicate must not be blank");
            }
            batching = batching != null ? batching : BatchSettings.UNBOUNDED;
        }
    }

    /**
     * @param days       age threshold in days, {@code >= 0}
     * @param dateColumn column compared against the threshold date
     * @param batching   batch size and pacing
     */
    record OlderThan(int days, String dateColumn, BatchSettings batching) implements DeleteStrategy {
        public OlderThan {
            if (days < 0) {
                throw new IllegalArgumentException("days must be >= 0");
            }
            dateColumn = Identifiers.validate(dateColumn != null ? dateColumn : DEFAULT_DATE_COLUMN);
            batching = batching != null ? batching : BatchSettings.UNBOUNDED;
        }
    }

    /**
     * A delete step that cannot run because its configuration is defective.
     *
     * @param reason human-readable defect description, logged as a warning when the table is processed
     */
    record Invalid(String reason) implements DeleteStrategy {
        public Invalid {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
