/*
 *  Copyright 2016 esbtools Contributors and/or its affiliates.
 *
 *  This file is part of esbtools.
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.esbtools.templatestore.filesystem;

import org.esbtools.templatestore.BaseDocument;
import org.esbtools.templatestore.DocumentStore;
import org.esbtools.templatestore.LanguageOverlay;
import org.esbtools.templatestore.VersionedDocument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps one JSON file per document: {@code base/<slug>.json} for base documents and
 * {@code lang/<language>/<slug>.json} for language overlays.
 *
 * <p>Files are written to a temporary file next to their destination and moved into place
 * atomically, so readers see either the old or the new document.
 */
@ThreadSafe
public class FileSystemDocumentStore implements DocumentStore {
    private final Path root;
    private final JsonDocumentCodec codec;

    private static final String SUFFIX = ".json";
    private static final Logger logger = LoggerFactory.getLogger(FileSystemDocumentStore.class);

    public FileSystemDocumentStore(Path root, JsonDocumentCodec codec) {
        this.root = Objects.requireNonNull(root, "root");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public FileSystemDocumentStore(Path root) {
        this(root, new JsonDocumentCodec());
    }

    @Override
    public Optional<BaseDocument> findBase(String slug) {
        return read(basePath(slug)).map(document -> (BaseDocument) document);
    }

    @Override
    public Optional<LanguageOverlay> findOverlay(String slug, String language) {
        return read(overlayPath(slug, language)).map(document -> (LanguageOverlay) document);
    }

    @Override
    public Optional<VersionedDocument> findByUuid(String uuid) {
        for (Path file : allFiles()) {
            Optional<VersionedDocument> document = read(file);
            if (document.isPresent() && document.get().getUuid().equals(uuid)) {
                return document;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<LanguageOverlay> overlaysOf(String slug) {
        List<LanguageOverlay> overlays = new ArrayList<>();

        for (Path languageDir : directoriesIn(root.resolve("lang"))) {
            read(languageDir.resolve(fileName(slug)))
                    .ifPresent(document -> overlays.add((LanguageOverlay) document));
        }

        return overlays;
    }

    @Override
    public synchronized void save(VersionedDocument document) throws IOException {
        Path destination = document instanceof LanguageOverlay
                ? overlayPath(document.getSlug(), ((LanguageOverlay) document).getLanguage())
                : basePath(document.getSlug());

        Files.createDirectories(destination.getParent());

        Path temp = Files.createTempFile(destination.getParent(), document.getSlug(), ".tmp");
        try {
            Files.write(temp, codec.toBytes(document));
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }

        logger.debug("Wrote {} to {}", document, destination);
    }

    private Optional<VersionedDocument> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }

        try {
            return Optional.of(codec.fromBytes(Files.readAllBytes(file)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read document from " + file, e);
        }
    }

    private List<Path> allFiles() {
        List<Path> files = new ArrayList<>();

        for (Path dir : new Path[] {root.resolve("base"), root.resolve("lang")}) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> walk = Files.walk(dir)) {
                walk.filter(path -> path.getFileName().toString().endsWith(SUFFIX))
                        .forEach(files::add);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list documents in " + dir, e);
            }
        }

        return files;
    }

    private static List<Path> directoriesIn(Path dir) {
        List<Path> directories = new ArrayList<>();

        if (!Files.isDirectory(dir)) {
            return directories;
        }

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
            entries.forEach(directories::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }

        return directories;
    }

    private Path basePath(String slug) {
        return root.resolve("base").resolve(fileName(slug));
    }

    private Path overlayPath(String slug, String language) {
        return root.resolve("lang").resolve(checkedName(language)).resolve(fileName(slug));
    }

    private static String fileName(String slug) {
        return checkedName(slug) + SUFFIX;
    }

    private static String checkedName(String name) {
        if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new IllegalArgumentException("Not usable as a file name: '" + name + "'");
        }
        return name;
    }
}
