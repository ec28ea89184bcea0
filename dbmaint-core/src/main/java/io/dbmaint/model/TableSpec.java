package io.dbmaint.model;

import io.dbmaint.sql.Identifiers;

import java.util.Objects;
import java.util.Optional;

/**
 * Maintenance configuration of one table.
 *
 * @param name             table name
 * @param dump             dump to take before any destructive step, if any
 * @param checkForeignKeys whether to run the advisory foreign-key audit
 * @param deleteStrategy   delete step
 * @param runOptimize      whether to optimize the table after the delete step
 */
public record TableSpec(
        String name,
        Optional<DumpRequest> dump,
        boolean checkForeignKeys,
        DeleteStrategy deleteStrategy,
        boolean runOptimize) {

    public TableSpec {
        Identifiers.validate(name);
        dump = dump != null ? dump : Optional.empty();
        deleteStrategy = deleteStrategy != null ? deleteStrategy : DeleteStrategy.NONE;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Builder for {@link TableSpec}; every option defaults to off. */
    public static final class Builder {
        private final String name;
        private DumpRequest dump;
        private boolean checkForeignKeys;
        private DeleteStrategy deleteStrategy = DeleteStrategy.NONE;
        private boolean runOptimize;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder dump(DumpRequest dump) {
            this.dump = dump;
            return this;
        }

        public Builder checkForeignKeys(boolean checkForeignKeys) {
            this.checkForeignKeys = checkForeignKeys;
            return this;
        }

        public Builder deleteStrategy(DeleteStrategy deleteStrategy) {
            this.deleteStrategy = deleteStrategy;
            return this;
        }

        public Builder runOptimize(boolean runOptimize) {
            this.runOptimize = runOptimize;
            return this;
        }

        public TableSpec build() {
            return new TableSpec(name, Optional.ofNullable(dump), checkForeignKeys, deleteStrategy, runOptimize);
        }
    }
}
