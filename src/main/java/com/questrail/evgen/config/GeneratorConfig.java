package com.questrail.evgen.config;

import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for channel-enumerating interaction list generators.
 *
 * <p>{@code chargedCurrent} and {@code neutralCurrent} are mutually exclusive.
 * Both {@code false} is legal; such a generator admits no channel at all.</p>
 */
public record GeneratorConfig(
        boolean chargedCurrent,
        boolean neutralCurrent
) {
    /** Property key selecting charged-current channels. */
    public static final String KEY_IS_CC = "is-CC";

    /** Property key selecting neutral-current channels. */
    public static final String KEY_IS_NC = "is-NC";

    public GeneratorConfig {
        if (chargedCurrent && neutralCurrent) {
            throw new IllegalArgumentException(KEY_IS_CC + " and " + KEY_IS_NC + " are mutually exclusive");
        }
    }

    public static GeneratorConfig chargedCurrentOnly() {
        return new GeneratorConfig(true, false);
    }

    public static GeneratorConfig neutralCurrentOnly() {
        return new GeneratorConfig(false, true);
    }

    /**
     * Reads {@value #KEY_IS_CC} and {@value #KEY_IS_NC}; a missing key means {@code false}.
     */
    public static GeneratorConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        return builder()
                .withChargedCurrent(Boolean.parseBoolean(properties.getProperty(KEY_IS_CC, "false").trim()))
                .withNeutralCurrent(Boolean.parseBoolean(properties.getProperty(KEY_IS_NC, "false").trim()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean chargedCurrent;
        private boolean neutralCurrent;

        public Builder withChargedCurrent(boolean chargedCurrent) {
            this.chargedCurrent = chargedCurrent;
            return this;
        }

        public Builder withNeutralCurrent(boolean neutralCurrent) {
            this.neutralCurrent = neutralCurrent;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(chargedCurrent, neutralCurrent);
        }
    }
}
