package com.gql2jsonschema.core.convert;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConvertOptions(
        @JsonProperty("ignoreInternals") boolean ignoreInternals,
        @JsonProperty("nullableArrayItems") boolean nullableArrayItems,
        @JsonProperty("idTypeMapping") IdTypeMapping idTypeMapping
) {
    public ConvertOptions {
        idTypeMapping = idTypeMapping == null ? IdTypeMapping.STRING : idTypeMapping;
    }

    public static ConvertOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean ignoreInternals = true;
        private boolean nullableArrayItems = false;
        private IdTypeMapping idTypeMapping = IdTypeMapping.STRING;

        public Builder ignoreInternals(boolean ignoreInternals) {
            this.ignoreInternals = ignoreInternals;
            return this;
        }

        public Builder nullableArrayItems(boolean nullableArrayItems) {
            this.nullableArrayItems = nullableArrayItems;
            return this;
        }

        public Builder idTypeMapping(IdTypeMapping idTypeMapping) {
            this.idTypeMapping = idTypeMapping;
            return this;
        }

        /**
         * @throws InvalidOptionException if {@code idTypeMapping} is not one of
         *                                {@code string}, {@code number} or {@code both}
         */
        public Builder idTypeMapping(String idTypeMapping) {
            this.idTypeMapping = IdTypeMapping.fromValue(idTypeMapping);
            return this;
        }

        public ConvertOptions build() {
            return new ConvertOptions(ignoreInternals, nullableArrayItems, idTypeMapping);
        }
    }
}
