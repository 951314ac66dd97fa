package com.umitunal.egserial.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Configuration for JSON documents and their files.
 */
public class SerializationConfig {
    private final int indentWidth;
    private final String fileExtension;
    private final Charset charset;
    private final boolean failOnUnknownProperties;
    private final boolean sortProperties;
    private final boolean snakeCaseProperties;

    private SerializationConfig(Builder builder) {
        this.indentWidth = builder.indentWidth;
        this.fileExtension = builder.fileExtension;
        this.charset = builder.charset;
        this.failOnUnknownProperties = builder.failOnUnknownProperties;
        this.sortProperties = builder.sortProperties;
        this.snakeCaseProperties = builder.snakeCaseProperties;
    }

    public int getIndentWidth() { return indentWidth; }
    public String getFileExtension() { return fileExtension; }
    public Charset getCharset() { return charset; }
    public boolean isFailOnUnknownProperties() { return failOnUnknownProperties; }
    public boolean isSortProperties() { return sortProperties; }
    public boolean isSnakeCaseProperties() { return snakeCaseProperties; }

    /**
     * Defaults: 2-space indentation, UTF-8, {@code .json} files,
     * unknown properties ignored, properties sorted and named in snake_case.
     */
    public static SerializationConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int indentWidth = 2;
        private String fileExtension = "json";
        private Charset charset = StandardCharsets.UTF_8;
        private boolean failOnUnknownProperties = false;
        private boolean sortProperties = true;
        private boolean snakeCaseProperties = true;

        private Builder() {
        }

        /**
         * Set the number of spaces per indentation level.
         * Default: 2
         */
        public Builder withIndentWidth(int spaces) {
            if (spaces < 0) {
                throw new IllegalArgumentException("Indent width must not be negative: " + spaces);
            }
            this.indentWidth = spaces;
            return this;
        }

        /**
         * Set the extension appended to document file names, without the dot.
         * Default: json
         */
        public Builder withFileExtension(String extension) {
            this.fileExtension = Objects.requireNonNull(extension, "extension");
            return this;
        }

        /**
         * Default: UTF-8
         */
        public Builder withCharset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        /**
         * Reject JSON fields that the target type does not declare.
         * Default: false
         */
        public Builder withFailOnUnknownProperties(boolean enable) {
            this.failOnUnknownProperties = enable;
            return this;
        }

        /**
         * Sort bean properties and map keys so output is stable.
         * Default: true
         */
        public Builder withSortProperties(boolean enable) {
            this.sortProperties = enable;
            return this;
        }

        /**
         * Name bean properties in snake_case ({@code elgamal_public_key}) as election
         * record documents do, instead of the Java property name.
         * Default: true
         */
        public Builder withSnakeCaseProperties(boolean enable) {
            this.snakeCaseProperties = enable;
            return this;
        }

        public SerializationConfig build() {
            return new SerializationConfig(this);
        }
    }
}
