package io.nosqlbench.forecast.serialize;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonParseException;
import io.nosqlbench.forecast.errors.ForecastException;
import io.nosqlbench.forecast.model.FittedForecastModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Writes and reads fitted models as JSON.
 *
 * <p>The document wraps the model with a format version:
 *
 * <pre>{@code
 * {
 *   "format_version": 1,
 *   "model": { "config": {...}, "family": {"type": "poisson"}, "scaling": {...}, ... }
 * }
 * }</pre>
 *
 * <p>A model read back predicts exactly like the model that was written, given a
 * configured seed.
 */
public final class FittedModelSerializer {

    private static final Logger logger = LogManager.getLogger(FittedModelSerializer.class);

    public static final int FORMAT_VERSION = 1;

    private FittedModelSerializer() {
    }

    public static String toJson(FittedForecastModel model) {
        Objects.requireNonNull(model, "model cannot be null");
        return ForecastGsonConfig.gson().toJson(new ModelDocument(FORMAT_VERSION, model));
    }

    /**
     * @param json a document written by {@link #toJson}
     * @return the fitted model
     * @throws ModelFormatException when the document is malformed or of another format version
     */
    public static FittedForecastModel fromJson(String json) {
        ModelDocument document;
        try {
            document = ForecastGsonConfig.gson().fromJson(json, ModelDocument.class);
        } catch (JsonParseException | IllegalStateException e) {
            throw new ModelFormatException("Invalid fitted model JSON: " + e.getMessage(), e);
        }
        if (document == null || document.model == null) {
            throw new ModelFormatException("Fitted model document is empty");
        }
        if (document.formatVersion != FORMAT_VERSION) {
            throw new ModelFormatException("Unsupported fitted model format version " + document.formatVersion
                + ", expected " + FORMAT_VERSION);
        }
        return document.model;
    }

    /**
     * Saves a model, replacing the target atomically.
     *
     * @param path the target file
     * @param model the model
     * @throws IOException if writing fails
     */
    public static void save(Path path, FittedForecastModel model) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        String json = toJson(model);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("saved fitted {} model to {}", model.getFamily().getTag(), path);
    }

    /**
     * @param path a file written by {@link #save}
     * @return the model
     * @throws IOException if reading fails
     * @throws ModelFormatException when the content is not a fitted model
     */
    public static FittedForecastModel load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new ModelFormatException("Fitted model file not found: " + path);
        }
        FittedForecastModel model = fromJson(Files.readString(path, StandardCharsets.UTF_8));
        logger.debug("loaded fitted {} model from {}", model.getFamily().getTag(), path);
        return model;
    }

    private static final class ModelDocument {
        private final int formatVersion;
        private final FittedForecastModel model;

        private ModelDocument(int formatVersion, FittedForecastModel model) {
            this.formatVersion = formatVersion;
            this.model = model;
        }
    }

    /**
     * Raised when a document cannot be read as a fitted model.
     */
    public static final class ModelFormatException extends ForecastException {
        public ModelFormatException(String message) {
            super(message);
        }

        public ModelFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
